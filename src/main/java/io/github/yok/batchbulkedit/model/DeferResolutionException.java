package io.github.yok.batchbulkedit.model;

/**
 * Raised when a FormulaValue defers to a parameter name that its recipe does not define.
 *
 * @author Yasuharu.Okawauchi
 */
public class DeferResolutionException extends RecipeEditException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message detail message
     */
    public DeferResolutionException(String message) {
        super(message);
    }
}
