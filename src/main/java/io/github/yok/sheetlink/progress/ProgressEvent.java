package io.github.yok.sheetlink.progress;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Cumulative counters of a run, published after each chunk settles.
 *
 * <p>
 * Counters never decrease between two events of the same run, and {@code attempted} always equals
 * {@code succeeded + failed}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ProgressEvent {

    // Run this event belongs to
    private final String operationId;
    // 1-based number of the chunk just settled
    private final int chunkNumber;
    // Rows resolved so far
    private final long attempted;
    // Rows written so far
    private final long succeeded;
    // Rows rejected or failed so far
    private final long failed;
    // Expected data rows, -1 when unknown
    private final long totalRows;

    /**
     * Returns the completion ratio in percent.
     *
     * @return 0 to 100, or -1 when the total is unknown
     */
    public int getPercent() {
        if (totalRows <= 0) {
            return -1;
        }
        return (int) Math.min(100, attempted * 100 / totalRows);
    }
}
