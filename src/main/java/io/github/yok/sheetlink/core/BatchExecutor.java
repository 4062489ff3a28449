package io.github.yok.sheetlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.sheetlink.db.DbDialectHandler;
import io.github.yok.sheetlink.db.SqlParameter;
import io.github.yok.sheetlink.db.SqlSession;
import io.github.yok.sheetlink.db.SqlStatement;
import io.github.yok.sheetlink.mapping.CompiledMapping;
import io.github.yok.sheetlink.mapping.ImportMode;
import io.github.yok.sheetlink.mapping.MappedRow;
import io.github.yok.sheetlink.mapping.RowProjection;
import io.github.yok.sheetlink.parser.SourceCursor;
import io.github.yok.sheetlink.parser.SourceRow;
import io.github.yok.sheetlink.progress.CancellationToken;
import io.github.yok.sheetlink.progress.ProgressEvent;
import io.github.yok.sheetlink.progress.ProgressSink;
import io.github.yok.sheetlink.schema.ColumnDescriptor;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the rows of a source cursor into the target table in chunk-sized transactions.
 *
 * <h2>Chunk life cycle</h2>
 *
 * <ol>
 * <li>Before a chunk opens, the cancellation token is checked; a requested cancellation ends the
 * run with {@link BatchOutcome#CANCELLED} and no further row is read.</li>
 * <li>Rows are pulled and projected one at a time. Rejected rows (and, in update mode, rows without
 * a key value) are counted at once and never reach the database. The chunk closes at
 * {@code chunkSize} accepted rows, at {@code chunkSize} rejected rows, or at the end of the
 * source.</li>
 * <li>The accepted rows are written in one transaction: multi-row INSERTs (or a JDBC batch when the
 * dialect has no multi-row INSERT), or one keyed UPDATE per row.</li>
 * <li>When a statement fails, the transaction is rolled back in full and the rows are written again
 * one by one in autocommit mode, so that a bad row costs only itself.</li>
 * <li>The chunk's failures are published in row order, then a progress event with cumulative
 * counters.</li>
 * </ol>
 *
 * <p>
 * A lost connection or an unreadable source ends the run with {@link BatchOutcome#ABORTED}. Chunks
 * committed before stay committed; rows of the interrupted chunk that were not resolved are not
 * counted.
 * </p>
 *
 * <p>
 * An instance serves exactly one run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchExecutor {

    private final String operationId;
    private final FailureLog failureLog;

    private boolean used;

    // Run state
    private final List<RowFailure> failures = new ArrayList<>();
    private final List<RowFailure> chunkFailures = new ArrayList<>();
    private long attempted;
    private long succeeded;
    private long failed;
    private int chunkNumber;

    public BatchExecutor(String operationId, FailureLog failureLog) {
        this.operationId = operationId;
        this.failureLog = failureLog;
    }

    /**
     * Runs the import.
     *
     * @param session open session on the target database
     * @param mapping compiled mapping for the cursor's header
     * @param cursor opened source cursor; not closed by this method
     * @param mode write mode, must match the mapping
     * @param chunkSize rows per transaction, at least 1
     * @param sink progress receiver
     * @param token cancellation flag
     * @return final result; {@link ProgressSink#onFinished(BatchResult)} has been called with it
     * @throws IllegalArgumentException if {@code chunkSize} is not positive or {@code mode} differs
     *         from the mapping's mode
     * @throws IllegalStateException if this executor has already run
     */
    public BatchResult run(SqlSession session, CompiledMapping mapping, SourceCursor cursor,
            ImportMode mode, int chunkSize, ProgressSink sink, CancellationToken token) {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
        Preconditions.checkArgument(mode == mapping.getMode(),
                "mode %s does not match the mapping mode %s", mode, mapping.getMode());
        Preconditions.checkState(!used, "BatchExecutor instances cannot be reused");
        used = true;

        Instant startedAt = Instant.now();
        log.info("[op={}] {} into {} from {} started (chunk size {}, about {} rows)", operationId,
                mode, mapping.getSchema().getIdentifier(), cursor.getSourceName(), chunkSize,
                cursor.getEstimatedRowCount());

        DbDialectHandler dialect = session.getDialect();
        ChunkWriter writer = new ChunkWriter(session, new DmlStatementFactory(dialect, mapping),
                new SqlErrorClassifier(dialect.getErrorCodesDatabaseName()), mode);
        ColumnDescriptor keyColumn = mapping.getKeyColumn();

        BatchOutcome outcome = BatchOutcome.COMPLETED;
        String fatalError = null;
        try {
            boolean exhausted = false;
            while (!exhausted) {
                if (token.isCancellationRequested()) {
                    outcome = BatchOutcome.CANCELLED;
                    log.info("[op={}] Cancellation observed after chunk {}", operationId,
                            chunkNumber);
                    break;
                }

                List<MappedRow> chunk = new ArrayList<>();
                int rejected = 0;
                while (chunk.size() < chunkSize && rejected < chunkSize) {
                    SourceRow row = readRow(cursor);
                    if (row == null) {
                        exhausted = true;
                        break;
                    }
                    RowProjection projection = mapping.apply(row);
                    if (!projection.isAccepted()) {
                        recordFailure(row, FailureReason.fromRejection(projection.getReason()),
                                projection.getColumn(), projection.getDetail());
                        rejected++;
                    } else if (keyColumn != null && projection.getMappedRow()
                            .getValue(keyColumn.getName()) == null) {
                        recordFailure(row, FailureReason.MISSING_KEY_VALUE, keyColumn.getName(),
                                "Key column " + keyColumn.getName() + " has no value");
                        rejected++;
                    } else {
                        chunk.add(projection.getMappedRow());
                    }
                }
                if (chunk.isEmpty() && rejected == 0) {
                    break;
                }

                chunkNumber++;
                writer.write(chunk);
                flushChunkFailures();
                sink.onProgress(new ProgressEvent(operationId, chunkNumber, attempted, succeeded,
                        failed, cursor.getEstimatedRowCount()));
            }
        } catch (RunAbortedException e) {
            flushChunkFailures();
            outcome = BatchOutcome.ABORTED;
            fatalError = e.getMessage();
            log.error("[op={}] Import aborted in chunk {} ({}): {}", operationId, chunkNumber,
                    e.getReason(), e.getMessage(), e.getCause());
            failureLog.append(FailureEvent.fatal(operationId, e.getReason().name(),
                    e.getRowNumber(), e.getMessage()));
        }

        BatchResult result = BatchResult.builder().operationId(operationId).mode(mode)
                .table(mapping.getSchema().getIdentifier()).attempted(attempted)
                .succeeded(succeeded).failed(failed).failures(failures).outcome(outcome)
                .fatalError(fatalError).startedAt(startedAt).finishedAt(Instant.now()).build();
        log.info("[op={}] Finished: outcome={}, chunks={}, attempted={}, succeeded={}, failed={}",
                operationId, outcome, chunkNumber, attempted, succeeded, failed);
        sink.onFinished(result);
        return result;
    }

    private SourceRow readRow(SourceCursor cursor) throws RunAbortedException {
        try {
            return cursor.nextRow();
        } catch (IOException e) {
            throw new RunAbortedException(FailureReason.SOURCE_READ_FAILED, null,
                    "Failed to read " + cursor.getSourceName() + ": " + e.getMessage(), e);
        }
    }

    private void recordFailure(SourceRow row, FailureReason reason, String column,
            String detail) {
        RowFailure failure =
                new RowFailure(row.getRowNumber(), row.getValues(), reason, column, detail);
        chunkFailures.add(failure);
        attempted++;
        failed++;
        log.warn("[op={}] Row {} not written ({}): {}", operationId, row.getRowNumber(), reason,
                detail);
    }

    // Projection rejections are recorded while the chunk fills, write failures after it is
    // written; both are published in row order.
    private void flushChunkFailures() {
        chunkFailures.sort(Comparator.comparingLong(RowFailure::getRowNumber));
        for (RowFailure failure : chunkFailures) {
            failures.add(failure);
            failureLog.append(FailureEvent.row(operationId, failure));
        }
        chunkFailures.clear();
    }

    /**
     * Executes chunks against the session.
     */
    private final class ChunkWriter {

        private final SqlSession session;
        private final DmlStatementFactory dml;
        private final SqlErrorClassifier classifier;
        private final ImportMode mode;

        ChunkWriter(SqlSession session, DmlStatementFactory dml, SqlErrorClassifier classifier,
                ImportMode mode) {
            this.session = session;
            this.dml = dml;
            this.classifier = classifier;
            this.mode = mode;
        }

        void write(List<MappedRow> chunk) throws RunAbortedException {
            if (chunk.isEmpty()) {
                return;
            }
            List<MappedRow> notFound = new ArrayList<>();
            try {
                session.begin();
                if (mode == ImportMode.INSERT) {
                    insertAll(chunk);
                } else {
                    updateAll(chunk, notFound);
                }
                session.commit();
            } catch (SQLException e) {
                FailureReason reason = classifier.classify(e);
                log.warn("[op={}] Chunk {} failed ({}): {}; rolling back and retrying {} rows"
                        + " one by one", operationId, chunkNumber, reason, e.getMessage(),
                        chunk.size());
                rollback(chunk.get(0));
                if (reason == FailureReason.CONNECTION_LOST && !session.isValid()) {
                    throw new RunAbortedException(FailureReason.CONNECTION_LOST,
                            chunk.get(0).getRowNumber(), "Connection lost: " + e.getMessage(), e);
                }
                retryOneByOne(chunk);
                return;
            }

            long written = chunk.size() - notFound.size();
            attempted += written;
            succeeded += written;
            for (MappedRow row : notFound) {
                recordKeyNotFound(row);
            }
            log.info("[op={}] Chunk {} committed: {} rows written", operationId, chunkNumber,
                    written);
        }

        private void insertAll(List<MappedRow> chunk) throws SQLException {
            if (session.getDialect().supportsMultiRowInsert()) {
                for (SqlStatement statement : dml.multiRowInserts(chunk)) {
                    session.executeUpdate(statement);
                }
            } else {
                List<List<SqlParameter>> parameterSets = new ArrayList<>(chunk.size());
                for (MappedRow row : chunk) {
                    parameterSets.add(dml.insertParameters(row));
                }
                session.executeBatch(dml.insertSql(), parameterSets);
            }
        }

        private void updateAll(List<MappedRow> chunk, List<MappedRow> notFound)
                throws SQLException {
            for (MappedRow row : chunk) {
                if (session.executeUpdate(dml.update(row)) == 0) {
                    notFound.add(row);
                }
            }
        }

        private void rollback(MappedRow firstRow) throws RunAbortedException {
            try {
                session.rollback();
            } catch (SQLException e) {
                FailureReason reason = session.isValid() ? FailureReason.DATABASE_ERROR
                        : FailureReason.CONNECTION_LOST;
                throw new RunAbortedException(reason, firstRow.getRowNumber(),
                        "Rollback of chunk " + chunkNumber + " failed: " + e.getMessage(), e);
            }
        }

        private void retryOneByOne(List<MappedRow> chunk) throws RunAbortedException {
            try {
                session.useAutoCommit();
            } catch (SQLException e) {
                FailureReason reason = session.isValid() ? FailureReason.DATABASE_ERROR
                        : FailureReason.CONNECTION_LOST;
                throw new RunAbortedException(reason, chunk.get(0).getRowNumber(),
                        "Cannot switch to autocommit: " + e.getMessage(), e);
            }
            long written = 0;
            for (MappedRow row : chunk) {
                int count;
                try {
                    SqlStatement statement =
                            mode == ImportMode.INSERT ? dml.insert(row) : dml.update(row);
                    count = session.executeUpdate(statement);
                } catch (SQLException e) {
                    FailureReason reason = classifier.classify(e);
                    if (reason == FailureReason.CONNECTION_LOST || !session.isValid()) {
                        throw new RunAbortedException(FailureReason.CONNECTION_LOST,
                                row.getRowNumber(), "Connection lost: " + e.getMessage(), e);
                    }
                    recordFailure(row.getSource(), reason, null, e.getMessage());
                    continue;
                }
                if (mode == ImportMode.UPDATE && count == 0) {
                    recordKeyNotFound(row);
                } else {
                    attempted++;
                    succeeded++;
                    written++;
                }
            }
            log.info("[op={}] Chunk {} retried row by row: {} of {} rows written", operationId,
                    chunkNumber, written, chunk.size());
        }

        private void recordKeyNotFound(MappedRow row) {
            String key = dml.getKeyColumnName();
            recordFailure(row.getSource(), FailureReason.KEY_NOT_FOUND, key,
                    "No row with " + key + " = " + row.getValue(key) + " in the target table");
        }
    }

    /**
     * Ends a run early.
     */
    private static final class RunAbortedException extends Exception {

        private static final long serialVersionUID = 1L;

        private final FailureReason reason;
        private final Long rowNumber;

        RunAbortedException(FailureReason reason, Long rowNumber, String message,
                Throwable cause) {
            super(message, cause);
            this.reason = reason;
            this.rowNumber = rowNumber;
        }

        FailureReason getReason() {
            return reason;
        }

        Long getRowNumber() {
            return rowNumber;
        }
    }
}
