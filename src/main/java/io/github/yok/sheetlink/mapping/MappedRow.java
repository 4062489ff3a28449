package io.github.yok.sheetlink.mapping;

import io.github.yok.sheetlink.parser.SourceRow;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Source row projected onto target columns with coerced values.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class MappedRow {

    // Row the values were taken from
    private final SourceRow source;
    // Target column (catalog spelling) to coerced value, in mapping order
    private final Map<String, Object> values;

    public MappedRow(SourceRow source, Map<String, Object> values) {
        this.source = source;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public long getRowNumber() {
        return source.getRowNumber();
    }

    public Object getValue(String column) {
        return values.get(column);
    }
}
