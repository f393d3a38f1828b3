package io.github.yok.batchbulkedit.model;

/**
 * Raised when a structural rule of the recipe document or the workbook is violated.
 *
 * <p>
 * Examples: a Parameter without any data type at canonicalization, a {@code FullPath} that does not
 * name a step, a step that does not exist, or two documents that would share one sheet name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ValidationException extends RecipeEditException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message detail message
     */
    public ValidationException(String message) {
        super(message);
    }
}
