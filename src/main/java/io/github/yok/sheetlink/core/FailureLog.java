package io.github.yok.sheetlink.core;

/**
 * Append-only destination of failure events.
 *
 * <p>
 * Implementations must accept calls from several runs at once and must not throw: a failure log
 * that cannot be written is reported in the application log and the import continues.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface FailureLog {

    /**
     * Appends one event.
     *
     * @param event event to record
     */
    void append(FailureEvent event);
}
