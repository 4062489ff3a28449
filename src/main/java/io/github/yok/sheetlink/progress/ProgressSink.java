package io.github.yok.sheetlink.progress;

import io.github.yok.sheetlink.core.BatchResult;

/**
 * Receiver of progress notifications from a running import.
 *
 * <p>
 * Methods are called on the import's worker thread and must not block.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ProgressSink {

    /**
     * Sink that ignores every notification.
     */
    ProgressSink NONE = event -> {
    };

    /**
     * Called after each chunk settles.
     *
     * @param event cumulative counters
     */
    void onProgress(ProgressEvent event);

    /**
     * Called exactly once when the run ends, whatever the outcome.
     *
     * @param result final result
     */
    default void onFinished(BatchResult result) {
        // no-op
    }
}
