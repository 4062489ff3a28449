package io.github.yok.sheetlink.parser;

import io.github.yok.sheetlink.ImportSetupException;
import lombok.Getter;

/**
 * Thrown when a source file cannot be opened as a tabular row stream.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SourceReadException extends ImportSetupException {

    private static final long serialVersionUID = 1L;

    /**
     * Failure categories of {@link SourceReadException}.
     */
    public enum Kind {
        // Extension not handled by any reader
        UNSUPPORTED_FORMAT,
        // Missing, unreadable, encrypted or structurally broken file
        CORRUPT_FILE,
        // No header row, or a header without data rows
        EMPTY_SOURCE,
        // Requested sheet does not exist in the workbook
        SHEET_NOT_FOUND
    }

    private final Kind kind;

    public SourceReadException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceReadException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public String getErrorCode() {
        return kind.name();
    }
}
