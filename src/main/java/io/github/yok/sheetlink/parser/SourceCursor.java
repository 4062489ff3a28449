package io.github.yok.sheetlink.parser;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Forward-only, lazily evaluated stream of {@link SourceRow}s read from one sheet.
 *
 * <p>
 * Rows are produced in source order. Blank rows are never returned. A cursor cannot be restarted;
 * reading the file again requires opening a new cursor.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SourceCursor extends Closeable {

    /**
     * Returns the normalized header.
     *
     * @return unique field names in column order
     */
    List<String> getHeader();

    /**
     * Reads the next data row.
     *
     * @return next row, or {@code null} when the source is exhausted
     * @throws IOException if the underlying file turns out to be unreadable mid-stream
     */
    SourceRow nextRow() throws IOException;

    /**
     * Returns the number of data rows the source is expected to hold.
     *
     * @return estimate including possible blank rows, or {@code -1} when unknown
     */
    long getEstimatedRowCount();

    /**
     * Returns a display name for logs (file and sheet).
     *
     * @return source name
     */
    String getSourceName();
}
