package io.github.yok.batchbulkedit.model;

/**
 * Raised when a row populates more type fields than its node variant allows.
 *
 * @author Yasuharu.Okawauchi
 */
public class TypeConflictException extends RecipeEditException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message detail message, starting with the offending node's full path
     */
    public TypeConflictException(String message) {
        super(message);
    }
}
