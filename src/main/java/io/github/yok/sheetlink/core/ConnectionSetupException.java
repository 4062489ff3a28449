package io.github.yok.sheetlink.core;

import io.github.yok.sheetlink.ImportSetupException;
import lombok.Getter;

/**
 * Thrown when the target database cannot be reached before an import starts.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConnectionSetupException extends ImportSetupException {

    private static final long serialVersionUID = 1L;

    /**
     * Kinds of connection setup failures.
     */
    public enum Kind {
        // Driver missing, login refused, host unreachable, or session setup failed
        CONNECTION_FAILED,
        // No connection profile with the requested ID
        UNKNOWN_CONNECTION
    }

    private final Kind kind;

    public ConnectionSetupException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConnectionSetupException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public String getErrorCode() {
        return kind.name();
    }
}
