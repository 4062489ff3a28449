package io.github.yok.sheetlink.progress;

import io.github.yok.sheetlink.core.BatchResult;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ProgressSink} that writes progress and the final summary to the application log.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void onProgress(ProgressEvent event) {
        if (event.getPercent() >= 0) {
            log.info("[op={}] chunk {}: {}/{} rows ({}%), succeeded={}, failed={}",
                    event.getOperationId(), event.getChunkNumber(), event.getAttempted(),
                    event.getTotalRows(), event.getPercent(), event.getSucceeded(),
                    event.getFailed());
        } else {
            log.info("[op={}] chunk {}: {} rows, succeeded={}, failed={}", event.getOperationId(),
                    event.getChunkNumber(), event.getAttempted(), event.getSucceeded(),
                    event.getFailed());
        }
    }

    @Override
    public void onFinished(BatchResult result) {
        log.info("[op={}] {} into {} finished: outcome={}, attempted={}, succeeded={}, failed={},"
                + " elapsed={}ms", result.getOperationId(), result.getMode(), result.getTable(),
                result.getOutcome(), result.getAttempted(), result.getSucceeded(),
                result.getFailed(), result.getElapsed().toMillis());
    }
}
