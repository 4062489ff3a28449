package io.github.yok.sheetlink.mapping;

import com.google.common.collect.ImmutableList;
import io.github.yok.sheetlink.parser.SourceRow;
import io.github.yok.sheetlink.schema.ColumnDescriptor;
import io.github.yok.sheetlink.schema.TableSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Validated mapping set bound to a table schema and a source header.
 *
 * <p>
 * Immutable and free of database access: {@link #apply(SourceRow)} only converts values, so one
 * instance can project any number of rows in any thread.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CompiledMapping {

    @Getter
    private final TableSchema schema;

    @Getter
    private final ImportMode mode;

    private final List<CompiledField> fields;
    private final CompiledField keyField;

    CompiledMapping(TableSchema schema, ImportMode mode, List<CompiledField> fields) {
        this.schema = schema;
        this.mode = mode;
        this.fields = ImmutableList.copyOf(fields);
        CompiledField key = null;
        if (mode == ImportMode.UPDATE) {
            for (CompiledField field : fields) {
                if (field.isKey()) {
                    key = field;
                }
            }
        }
        this.keyField = key;
    }

    /**
     * Returns the written columns in mapping order (INSERT column list).
     *
     * @return target columns
     */
    public List<ColumnDescriptor> getTargetColumns() {
        List<ColumnDescriptor> columns = new ArrayList<>(fields.size());
        for (CompiledField field : fields) {
            columns.add(field.getColumn());
        }
        return columns;
    }

    /**
     * Returns the columns assigned by an UPDATE, i.e. every written column except the key.
     *
     * @return columns of the SET clause, empty in insert mode
     */
    public List<ColumnDescriptor> getUpdateColumns() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        if (keyField == null) {
            return columns;
        }
        for (CompiledField field : fields) {
            if (field != keyField) {
                columns.add(field.getColumn());
            }
        }
        return columns;
    }

    /**
     * Returns the key column in update mode.
     *
     * @return key column, {@code null} in insert mode
     */
    public ColumnDescriptor getKeyColumn() {
        return keyField == null ? null : keyField.getColumn();
    }

    /**
     * Projects a source row onto the target columns.
     *
     * <p>
     * A null value for a non-nullable column rejects the row with
     * {@link RejectionReason#REQUIRED_VALUE_MISSING}. In update mode the key column is exempt; a
     * missing key is reported by the executor.
     * </p>
     *
     * @param row source row
     * @return accepted row or rejection
     */
    public RowProjection apply(SourceRow row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (CompiledField field : fields) {
            ColumnDescriptor column = field.getColumn();
            Object value;
            if (field.isConstant()) {
                value = field.getConstantValue();
            } else {
                Object raw = row.get(field.getSourceField());
                try {
                    value = field.getCoercer().coerce(raw);
                } catch (CoercionException e) {
                    return RowProjection.rejected(row, RejectionReason.TYPE_COERCION_FAILED,
                            column.getName(), "Field '" + field.getSourceField() + "' value '" + raw
                                    + "' -> " + column.getName() + ": " + e.getMessage());
                }
            }
            if (value == null && !column.isNullable() && field != keyField) {
                return RowProjection.rejected(row, RejectionReason.REQUIRED_VALUE_MISSING,
                        column.getName(), "Column " + column.getName() + " does not accept null");
            }
            values.put(column.getName(), value);
        }
        return RowProjection.accepted(new MappedRow(row, values));
    }
}
