package io.github.yok.sheetlink.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry of the failure log.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FailureEvent {

    /**
     * Severity of an event.
     */
    public enum Severity {
        // One row was not written; the run went on
        ROW,
        // The run did not start or was aborted
        FATAL
    }

    private final Instant timestamp;
    private final String operationId;
    private final Severity severity;
    // FailureReason name or setup error code
    private final String code;
    // Source row number, null for events not tied to a row
    private final Long rowNumber;
    private final String detail;
    // Raw source values, empty when not tied to a row
    private final Map<String, Object> snapshot;

    private FailureEvent(Instant timestamp, String operationId, Severity severity, String code,
            Long rowNumber, String detail, Map<String, Object> snapshot) {
        this.timestamp = timestamp;
        this.operationId = operationId;
        this.severity = severity;
        this.code = code;
        this.rowNumber = rowNumber;
        this.detail = detail;
        this.snapshot = snapshot == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }

    /**
     * Creates an event for a failed row.
     *
     * @param operationId run ID
     * @param failure failed row
     * @return event stamped now
     */
    public static FailureEvent row(String operationId, RowFailure failure) {
        return new FailureEvent(Instant.now(), operationId, Severity.ROW,
                failure.getReason().name(), failure.getRowNumber(), failure.getDetail(),
                failure.getRawSnapshot());
    }

    /**
     * Creates an event for a fatal error.
     *
     * @param operationId run ID
     * @param code error code
     * @param rowNumber row being processed, or {@code null}
     * @param detail error message
     * @return event stamped now
     */
    public static FailureEvent fatal(String operationId, String code, Long rowNumber,
            String detail) {
        return new FailureEvent(Instant.now(), operationId, Severity.FATAL, code, rowNumber,
                detail, null);
    }
}
