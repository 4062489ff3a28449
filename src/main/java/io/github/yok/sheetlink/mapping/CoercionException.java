package io.github.yok.sheetlink.mapping;

/**
 * Signals that a value cannot be converted to a column's type.
 *
 * @author Yasuharu.Okawauchi
 */
public class CoercionException extends Exception {

    private static final long serialVersionUID = 1L;

    public CoercionException(String message) {
        super(message);
    }

    public CoercionException(String message, Throwable cause) {
        super(message, cause);
    }
}
