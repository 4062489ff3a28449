package io.github.yok.sheetlink.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running import.
 *
 * <p>
 * The executor polls the flag only between chunks, so a chunk in flight always settles (commit or
 * rollback and retry) before the run stops.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean();

    /**
     * Requests cancellation. Calling it more than once has no further effect.
     */
    public void cancel() {
        requested.set(true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }
}
