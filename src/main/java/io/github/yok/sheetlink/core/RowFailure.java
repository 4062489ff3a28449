package io.github.yok.sheetlink.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One source row that was not written, with enough context to fix the file and retry.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RowFailure {

    // 1-based source row number
    private final long rowNumber;
    // Copy of the raw source values
    private final Map<String, Object> rawSnapshot;
    private final FailureReason reason;
    // Target column, null when the failure is not tied to one column
    private final String column;
    private final String detail;

    public RowFailure(long rowNumber, Map<String, Object> rawSnapshot, FailureReason reason,
            String column, String detail) {
        this.rowNumber = rowNumber;
        this.rawSnapshot = Collections.unmodifiableMap(new LinkedHashMap<>(rawSnapshot));
        this.reason = reason;
        this.column = column;
        this.detail = detail;
    }
}
