package io.github.yok.sheetlink.progress;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;
import io.github.yok.sheetlink.core.BatchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProgressSink} that buffers events for a caller polling from another thread.
 *
 * <p>
 * The buffer is bounded and lossy: when it is full, the oldest event is dropped so that the import
 * never waits for a slow consumer. Events carry cumulative counters, so a consumer that misses some
 * still sees correct totals in the next one. The final {@link BatchResult} is never dropped and is
 * obtained with {@link #awaitResult(long, TimeUnit)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ProgressChannel implements ProgressSink {

    private final EvictingQueue<ProgressEvent> queue;
    private final CountDownLatch finished = new CountDownLatch(1);

    private long droppedCount;
    private volatile BatchResult result;

    /**
     * Creates a channel.
     *
     * @param capacity number of events kept before the oldest is dropped
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public ProgressChannel(int capacity) {
        Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
        this.queue = EvictingQueue.create(capacity);
    }

    @Override
    public synchronized void onProgress(ProgressEvent event) {
        if (queue.remainingCapacity() == 0) {
            droppedCount++;
        }
        queue.add(event);
        notifyAll();
    }

    @Override
    public void onFinished(BatchResult batchResult) {
        synchronized (this) {
            if (result != null) {
                return;
            }
            result = batchResult;
            notifyAll();
        }
        finished.countDown();
    }

    /**
     * Takes the oldest buffered event.
     *
     * @return event, or {@code null} when none is buffered
     */
    public synchronized ProgressEvent poll() {
        return queue.poll();
    }

    /**
     * Takes the oldest buffered event, waiting until one arrives, the run finishes, or the timeout
     * elapses.
     *
     * @param timeout maximum wait
     * @param unit unit of {@code timeout}
     * @return event, or {@code null} if none arrived
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public synchronized ProgressEvent poll(long timeout, TimeUnit unit)
            throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (queue.isEmpty() && result == null) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return queue.poll();
    }

    /**
     * Takes every buffered event.
     *
     * @return events in publication order, possibly empty
     */
    public synchronized List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>(queue);
        queue.clear();
        return events;
    }

    /**
     * Returns how many events were dropped because the buffer was full.
     *
     * @return dropped events since creation
     */
    public synchronized long getDroppedCount() {
        return droppedCount;
    }

    public boolean isFinished() {
        return result != null;
    }

    /**
     * Waits for the final result of the run.
     *
     * @param timeout maximum wait
     * @param unit unit of {@code timeout}
     * @return final result
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws TimeoutException if the run does not finish in time
     */
    public BatchResult awaitResult(long timeout, TimeUnit unit)
            throws InterruptedException, TimeoutException {
        if (!finished.await(timeout, unit)) {
            throw new TimeoutException("Import did not finish within " + timeout + " " + unit);
        }
        return result;
    }
}
