/**
 * Progress reporting and cooperative cancellation.
 *
 * <p>
 * A running import publishes {@link io.github.yok.sheetlink.progress.ProgressEvent}s to a
 * {@link io.github.yok.sheetlink.progress.ProgressSink} after each chunk and observes a
 * {@link io.github.yok.sheetlink.progress.CancellationToken} between chunks. The
 * {@link io.github.yok.sheetlink.progress.ProgressChannel} decouples the import thread from a
 * polling consumer.
 * </p>
 */
package io.github.yok.sheetlink.progress;
