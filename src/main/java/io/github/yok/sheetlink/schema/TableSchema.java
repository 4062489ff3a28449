package io.github.yok.sheetlink.schema;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable catalog description of a target table.
 *
 * <p>
 * Column names are unique case-insensitively. Primary-key columns are kept in key-sequence order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class TableSchema {

    // Identifier resolved against the catalog (catalog spelling)
    private final TableIdentifier identifier;
    // Columns in ordinal order
    private final List<ColumnDescriptor> columns;
    // Primary-key columns in key-sequence order
    private final List<ColumnDescriptor> primaryKeyColumns;

    /**
     * Creates a table schema.
     *
     * @param identifier resolved table identifier
     * @param columns columns in ordinal order
     * @param primaryKeyColumnNames primary-key column names in key-sequence order
     * @throws IllegalArgumentException if a column name repeats or a key column is unknown
     */
    public TableSchema(TableIdentifier identifier, List<ColumnDescriptor> columns,
            List<String> primaryKeyColumnNames) {
        this.identifier = identifier;
        Set<String> seen = new HashSet<>();
        for (ColumnDescriptor column : columns) {
            if (!seen.add(column.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException(
                        "Duplicate column name in " + identifier + ": " + column.getName());
            }
        }
        this.columns = ImmutableList.copyOf(columns);
        List<ColumnDescriptor> keys = new ArrayList<>();
        for (String keyName : primaryKeyColumnNames) {
            ColumnDescriptor key = findColumn(keyName).orElseThrow(() -> new IllegalArgumentException(
                    "Primary key column not found in " + identifier + ": " + keyName));
            keys.add(key);
        }
        this.primaryKeyColumns = ImmutableList.copyOf(keys);
    }

    /**
     * Looks up a column by name.
     *
     * <p>
     * An exact match wins. Otherwise a case-insensitive match is returned when exactly one column
     * matches.
     * </p>
     *
     * @param name column name as written by the user
     * @return matching column, or empty
     */
    public Optional<ColumnDescriptor> findColumn(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ColumnDescriptor caseInsensitive = null;
        for (ColumnDescriptor column : columns) {
            if (column.getName().equals(name)) {
                return Optional.of(column);
            }
            if (column.getName().equalsIgnoreCase(name)) {
                caseInsensitive = column;
            }
        }
        return Optional.ofNullable(caseInsensitive);
    }

    /**
     * Returns whether the table has a single-column primary key.
     *
     * @return {@code true} when exactly one key column exists
     */
    public boolean hasSingleColumnPrimaryKey() {
        return primaryKeyColumns.size() == 1;
    }
}
