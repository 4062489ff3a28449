package io.github.yok.sheetlink.schema;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable description of one column of a target table, as read from the database catalog.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ColumnDescriptor {

    // Column name in catalog spelling
    private final String name;
    // 1-based position in the table
    private final int ordinal;
    // Coarse type classification
    private final DataKind kind;
    // java.sql.Types code reported by the driver
    private final int jdbcType;
    // Database-specific type name (e.g., nvarchar, numeric)
    private final String typeName;
    // Declared size (character length or numeric precision), 0 when not reported
    private final int size;
    // Decimal digits, 0 when not applicable
    private final int scale;
    // Whether NULL is accepted
    private final boolean nullable;
    // Whether the database supplies a value when the column is omitted
    private final boolean hasDefault;
    // Whether the column is part of the primary key
    private final boolean primaryKey;

    /**
     * Returns whether an INSERT must provide a non-null value for this column.
     *
     * @return {@code true} for non-nullable columns without a default
     */
    public boolean isRequired() {
        return !nullable && !hasDefault;
    }
}
