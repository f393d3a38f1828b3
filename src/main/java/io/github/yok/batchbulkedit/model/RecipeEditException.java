package io.github.yok.batchbulkedit.model;

/**
 * Base type of the errors raised while mapping recipe documents to and from a workbook.
 *
 * <p>
 * Every subtype aborts the current run. The command line front end reports them as validation
 * errors and exits with status {@code 1}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ValidationException
 * @see TypeConflictException
 * @see DeferResolutionException
 */
public abstract class RecipeEditException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message detail message
     */
    protected RecipeEditException(String message) {
        super(message);
    }

    /**
     * Creates an exception with the given message and cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    protected RecipeEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
