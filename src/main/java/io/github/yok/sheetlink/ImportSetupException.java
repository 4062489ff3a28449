package io.github.yok.sheetlink;

/**
 * Base class of the errors that stop an import before any row is written.
 *
 * <p>
 * Every subclass reports a stable error code so that callers and the failure log can identify the
 * failure without parsing messages.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class ImportSetupException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    protected ImportSetupException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    protected ImportSetupException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the stable error code of this failure.
     *
     * @return error code such as {@code SCHEMA_NOT_FOUND}
     */
    public abstract String getErrorCode();
}
