package io.github.yok.sheetlink.parser;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Common row handling for every source container.
 *
 * <p>
 * Subclasses only deliver physical rows as cell lists through {@link #readRawRow()}. This class
 * turns them into {@link SourceRow}s:
 * </p>
 * <ul>
 * <li>The first non-blank row is the header. Blank header cells become {@code Unnamed: <index>},
 * repeated names get {@code .1}, {@code .2} suffixes.</li>
 * <li>Blank rows are skipped.</li>
 * <li>Short rows are padded with {@code null}; cells beyond the header width are dropped.</li>
 * <li>Empty strings are reported as {@code null}.</li>
 * </ul>
 * <p>
 * {@link #open()} reads the header and looks one data row ahead, so that a source without data is
 * rejected before any row flows.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractSourceCursor implements SourceCursor {

    @Getter
    private final String sourceName;

    private List<String> header;
    private long headerRowNumber;
    private SourceRow lookahead;
    private long droppedCells;

    protected AbstractSourceCursor(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Physical row as read from the container.
     */
    @Getter
    @RequiredArgsConstructor
    protected static final class RawRow {
        // 1-based physical row number
        private final long rowNumber;
        // Cell values by column index; may contain nulls
        private final List<Object> cells;
    }

    /**
     * Reads the next physical row.
     *
     * @return next row, or {@code null} at the end of the sheet
     * @throws IOException if the container cannot be read
     */
    protected abstract RawRow readRawRow() throws IOException;

    /**
     * Returns the last physical row number declared by the container.
     *
     * @return 1-based row number, or {@code -1} when the container does not declare it
     */
    protected abstract long getLastRowNumber();

    /**
     * Reads the header and the first data row.
     *
     * @throws IOException if the container cannot be read
     * @throws SourceReadException with {@link SourceReadException.Kind#EMPTY_SOURCE} when there is
     *         no header or no data row
     */
    final void open() throws IOException, SourceReadException {
        RawRow headerRow = nextNonBlank();
        if (headerRow == null) {
            throw new SourceReadException(SourceReadException.Kind.EMPTY_SOURCE,
                    sourceName + " contains no rows");
        }
        header = Collections.unmodifiableList(normalizeHeader(headerRow.getCells()));
        headerRowNumber = headerRow.getRowNumber();
        lookahead = readDataRow();
        if (lookahead == null) {
            throw new SourceReadException(SourceReadException.Kind.EMPTY_SOURCE,
                    sourceName + " has a header but no data rows");
        }
        log.debug("Opened {}: header row={}, fields={}", sourceName, headerRowNumber, header);
    }

    @Override
    public List<String> getHeader() {
        return header;
    }

    @Override
    public SourceRow nextRow() throws IOException {
        if (lookahead != null) {
            SourceRow row = lookahead;
            lookahead = null;
            return row;
        }
        SourceRow row = readDataRow();
        if (row == null && droppedCells > 0) {
            log.debug("{}: {} cells beyond the header width were ignored", sourceName,
                    droppedCells);
            droppedCells = 0;
        }
        return row;
    }

    @Override
    public long getEstimatedRowCount() {
        long last = getLastRowNumber();
        if (last < 0) {
            return -1;
        }
        return Math.max(0, last - headerRowNumber);
    }

    private SourceRow readDataRow() throws IOException {
        RawRow raw = nextNonBlank();
        if (raw == null) {
            return null;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        List<Object> cells = raw.getCells();
        for (int i = 0; i < header.size(); i++) {
            values.put(header.get(i), i < cells.size() ? emptyToNull(cells.get(i)) : null);
        }
        for (int i = header.size(); i < cells.size(); i++) {
            if (!isBlank(cells.get(i))) {
                droppedCells++;
            }
        }
        return new SourceRow(raw.getRowNumber(), values);
    }

    private RawRow nextNonBlank() throws IOException {
        RawRow raw = readRawRow();
        while (raw != null && isBlankRow(raw.getCells())) {
            raw = readRawRow();
        }
        return raw;
    }

    /**
     * Builds unique, non-blank field names from header cells.
     *
     * @param cells header cells
     * @return normalized names; trailing blank cells are not part of the header
     */
    static List<String> normalizeHeader(List<Object> cells) {
        int width = cells.size();
        while (width > 0 && isBlank(cells.get(width - 1))) {
            width--;
        }
        List<String> names = new ArrayList<>(width);
        Set<String> used = new HashSet<>();
        for (int i = 0; i < width; i++) {
            String name = StringUtils.trimToNull(headerText(cells.get(i)));
            if (name == null) {
                name = "Unnamed: " + i;
            }
            String unique = name;
            int suffix = 1;
            while (used.contains(unique)) {
                unique = name + "." + suffix++;
            }
            used.add(unique);
            names.add(unique);
        }
        return names;
    }

    private static String headerText(Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof BigDecimal) {
            return ((BigDecimal) cell).stripTrailingZeros().toPlainString();
        }
        if (cell instanceof LocalDateTime) {
            LocalDateTime dateTime = (LocalDateTime) cell;
            return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)
                    ? dateTime.toLocalDate().toString()
                    : dateTime.toString();
        }
        return cell.toString();
    }

    private static Object emptyToNull(Object cell) {
        if (cell instanceof String && ((String) cell).isEmpty()) {
            return null;
        }
        return cell;
    }

    private static boolean isBlankRow(List<Object> cells) {
        for (Object cell : cells) {
            if (!isBlank(cell)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(Object cell) {
        if (cell == null) {
            return true;
        }
        return cell instanceof String && StringUtils.isBlank((String) cell);
    }
}
