package io.github.yok.sheetlink.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One data row of a source, keyed by the normalized header.
 *
 * <p>
 * Values are {@link String}, {@link java.math.BigDecimal}, {@link java.time.LocalDateTime},
 * {@link Boolean} or {@code null}. The row number is the 1-based physical row (or line) of the
 * source, so that failures can be traced back to the file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SourceRow {

    private final long rowNumber;
    private final Map<String, Object> values;

    /**
     * Creates a row.
     *
     * @param rowNumber 1-based physical row number
     * @param values field values in header order (copied)
     */
    public SourceRow(long rowNumber, Map<String, Object> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a field.
     *
     * @param field header name
     * @return raw value, {@code null} when the cell is empty or the field is unknown
     */
    public Object get(String field) {
        return values.get(field);
    }
}
