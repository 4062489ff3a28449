package io.github.yok.sheetlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.sheetlink.mapping.ImportMode;
import io.github.yok.sheetlink.schema.TableIdentifier;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Final, immutable account of one import run.
 *
 * <p>
 * {@code attempted == succeeded + failed} and {@code failures.size() == failed}. Rows after a
 * cancellation or a fatal error are not counted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class BatchResult {

    private final String operationId;
    private final ImportMode mode;
    private final TableIdentifier table;
    private final long attempted;
    private final long succeeded;
    private final long failed;
    // Failed rows in source order
    private final List<RowFailure> failures;
    private final BatchOutcome outcome;
    // Message of the fatal error, null unless ABORTED
    private final String fatalError;
    private final Instant startedAt;
    private final Instant finishedAt;

    @Builder
    private BatchResult(String operationId, ImportMode mode, TableIdentifier table, long attempted,
            long succeeded, long failed, List<RowFailure> failures, BatchOutcome outcome,
            String fatalError, Instant startedAt, Instant finishedAt) {
        this.operationId = operationId;
        this.mode = mode;
        this.table = table;
        this.attempted = attempted;
        this.succeeded = succeeded;
        this.failed = failed;
        this.failures = failures == null ? ImmutableList.of() : ImmutableList.copyOf(failures);
        this.outcome = outcome;
        this.fatalError = fatalError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    /**
     * Returns the wall-clock duration of the run.
     *
     * @return elapsed time, zero when a timestamp is missing
     */
    public Duration getElapsed() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
