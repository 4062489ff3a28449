package io.github.yok.sheetlink.core;

/**
 * How a run ended.
 *
 * @author Yasuharu.Okawauchi
 */
public enum BatchOutcome {

    // Every source row was resolved
    COMPLETED,

    // Cancellation was observed at a chunk boundary
    CANCELLED,

    // A fatal error (lost connection, unreadable source) stopped the run
    ABORTED
}
