package io.github.yok.sheetlink.mapping;

import io.github.yok.sheetlink.ImportSetupException;
import lombok.Getter;

/**
 * Thrown when a mapping set cannot be compiled against a table schema and a source header.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MappingException extends ImportSetupException {

    private static final long serialVersionUID = 1L;

    private final MappingErrorKind kind;

    public MappingException(MappingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MappingException(MappingErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public String getErrorCode() {
        return kind.name();
    }
}
