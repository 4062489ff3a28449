package io.github.yok.sheetlink.mapping;

import io.github.yok.sheetlink.schema.ColumnDescriptor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * One validated, non-skipped mapping bound to its catalog column.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
final class CompiledField {

    // Target column from the catalog
    private final ColumnDescriptor column;
    // Source field name, null for constants
    private final String sourceField;
    // Pre-coerced constant, used when sourceField is null
    private final Object constantValue;
    // Converter for source values
    private final ValueCoercer coercer;
    // Whether this field identifies the row in update mode
    private final boolean key;

    boolean isConstant() {
        return sourceField == null;
    }
}
