package io.github.yok.sheetlink.mapping;

import io.github.yok.sheetlink.schema.ColumnDescriptor;
import io.github.yok.sheetlink.schema.TableSchema;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates a user mapping set against a table schema and a source header, and compiles it into a
 * {@link CompiledMapping}.
 *
 * <p>
 * Checks run in a fixed order and the first violation is thrown:
 * </p>
 * <ol>
 * <li>at least one column is written ({@link MappingErrorKind#NO_COLUMNS_MAPPED})</li>
 * <li>every target column exists ({@link MappingErrorKind#UNKNOWN_TARGET_COLUMN}) and is mapped
 * once ({@link MappingErrorKind#DUPLICATE_TARGET_COLUMN})</li>
 * <li>every source field exists in the header ({@link MappingErrorKind#UNKNOWN_SOURCE_FIELD})</li>
 * <li>coercion rules and constants are valid ({@link MappingErrorKind#INVALID_COERCION_RULE},
 * {@link MappingErrorKind#INVALID_CONSTANT})</li>
 * <li>update mode: exactly one key, read from a source field, naming a primary-key column, and at
 * least one other written column</li>
 * <li>insert mode: every non-nullable column without a default is written
 * ({@link MappingErrorKind#REQUIRED_COLUMN_UNMAPPED})</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MappingResolver {

    // Locale for numeric parsing when a rule names none
    private final Locale defaultLocale;

    public MappingResolver() {
        this(Locale.US);
    }

    public MappingResolver(Locale defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    /**
     * Compiles a mapping set.
     *
     * @param schema target table schema
     * @param sourceHeader normalized source header
     * @param mappings user mappings
     * @param mode write mode
     * @return compiled mapping
     * @throws MappingException if the mapping set is invalid
     */
    public CompiledMapping compile(TableSchema schema, List<String> sourceHeader,
            List<FieldMapping> mappings, ImportMode mode) throws MappingException {
        List<FieldMapping> written = mappings.stream()
                .filter(m -> m.getSourceType() != MappingSourceType.SKIP)
                .collect(Collectors.toList());
        if (written.isEmpty()) {
            throw new MappingException(MappingErrorKind.NO_COLUMNS_MAPPED,
                    "No columns selected for import into " + schema.getIdentifier());
        }

        Map<FieldMapping, ColumnDescriptor> columns = resolveTargets(schema, mappings);
        checkSourceFields(sourceHeader, written);

        List<CompiledField> fields = new ArrayList<>();
        for (FieldMapping mapping : written) {
            ColumnDescriptor column = columns.get(mapping);
            ValueCoercer coercer = createCoercer(column, mapping);
            if (mapping.getSourceType() == MappingSourceType.CONSTANT) {
                Object constant = coerceConstant(column, mapping, coercer);
                fields.add(new CompiledField(column, null, constant, coercer,
                        mapping.isKey() && mode == ImportMode.UPDATE));
            } else {
                fields.add(new CompiledField(column, mapping.getSourceField(), null, coercer,
                        mapping.isKey() && mode == ImportMode.UPDATE));
            }
        }

        if (mode == ImportMode.UPDATE) {
            checkKey(schema, mappings, columns);
        } else {
            checkRequiredColumns(schema, written, columns);
        }

        CompiledMapping compiled = new CompiledMapping(schema, mode, fields);
        log.info("Compiled mapping: table={}, mode={}, columns={}, key={}", schema.getIdentifier(),
                mode, compiled.getTargetColumns().stream().map(ColumnDescriptor::getName)
                        .collect(Collectors.toList()),
                compiled.getKeyColumn() == null ? "-" : compiled.getKeyColumn().getName());
        return compiled;
    }

    private Map<FieldMapping, ColumnDescriptor> resolveTargets(TableSchema schema,
            List<FieldMapping> mappings) throws MappingException {
        Map<FieldMapping, ColumnDescriptor> columns = new IdentityHashMap<>();
        Set<String> seen = new HashSet<>();
        for (FieldMapping mapping : mappings) {
            ColumnDescriptor column = schema.findColumn(mapping.getTargetColumn())
                    .orElseThrow(() -> new MappingException(
                            MappingErrorKind.UNKNOWN_TARGET_COLUMN,
                            "Column not found in " + schema.getIdentifier() + ": "
                                    + mapping.getTargetColumn()));
            if (!seen.add(column.getName())) {
                throw new MappingException(MappingErrorKind.DUPLICATE_TARGET_COLUMN,
                        "Column mapped more than once: " + column.getName());
            }
            columns.put(mapping, column);
        }
        return columns;
    }

    private void checkSourceFields(List<String> sourceHeader, List<FieldMapping> written)
            throws MappingException {
        Set<String> header = new HashSet<>(sourceHeader);
        for (FieldMapping mapping : written) {
            if (mapping.getSourceType() == MappingSourceType.FIELD
                    && !header.contains(mapping.getSourceField())) {
                throw new MappingException(MappingErrorKind.UNKNOWN_SOURCE_FIELD,
                        "Source field not found: '" + mapping.getSourceField()
                                + "' (available: " + sourceHeader + ")");
            }
        }
    }

    private ValueCoercer createCoercer(ColumnDescriptor column, FieldMapping mapping)
            throws MappingException {
        try {
            return ValueCoercer.create(column, mapping.getCoercion(), defaultLocale);
        } catch (IllegalArgumentException e) {
            throw new MappingException(MappingErrorKind.INVALID_COERCION_RULE,
                    "Invalid coercion rule for column " + column.getName() + ": "
                            + e.getMessage(),
                    e);
        }
    }

    private Object coerceConstant(ColumnDescriptor column, FieldMapping mapping,
            ValueCoercer coercer) throws MappingException {
        Object value;
        try {
            value = coercer.coerce(mapping.getConstantValue());
        } catch (CoercionException e) {
            throw new MappingException(MappingErrorKind.INVALID_CONSTANT,
                    "Constant '" + mapping.getConstantValue() + "' does not fit column "
                            + column.getName() + ": " + e.getMessage(),
                    e);
        }
        if (value == null && !column.isNullable()) {
            throw new MappingException(MappingErrorKind.INVALID_CONSTANT,
                    "Constant for column " + column.getName() + " is empty but the column is"
                            + " not nullable");
        }
        return value;
    }

    private void checkKey(TableSchema schema, List<FieldMapping> mappings,
            Map<FieldMapping, ColumnDescriptor> columns) throws MappingException {
        List<FieldMapping> keys =
                mappings.stream().filter(FieldMapping::isKey).collect(Collectors.toList());
        if (keys.isEmpty()) {
            throw new MappingException(MappingErrorKind.MISSING_KEY_MAPPING,
                    "Update mode requires one mapping flagged as key");
        }
        if (keys.size() > 1) {
            throw new MappingException(MappingErrorKind.AMBIGUOUS_KEY_MAPPING,
                    "Only one key mapping is allowed, found " + keys.stream()
                            .map(FieldMapping::getTargetColumn).collect(Collectors.toList()));
        }
        FieldMapping key = keys.get(0);
        ColumnDescriptor keyColumn = columns.get(key);
        if (key.getSourceType() != MappingSourceType.FIELD) {
            throw new MappingException(MappingErrorKind.INVALID_KEY_COLUMN,
                    "Key column " + keyColumn.getName() + " must be read from a source field");
        }
        if (!keyColumn.isPrimaryKey()) {
            throw new MappingException(MappingErrorKind.INVALID_KEY_COLUMN,
                    "Key column " + keyColumn.getName() + " is not part of the primary key of "
                            + schema.getIdentifier());
        }
        if (!schema.hasSingleColumnPrimaryKey()) {
            throw new MappingException(MappingErrorKind.INVALID_KEY_COLUMN,
                    "Key column " + keyColumn.getName() + " does not identify a single row: "
                            + schema.getIdentifier() + " has the composite primary key "
                            + schema.getPrimaryKeyColumns().stream()
                                    .map(ColumnDescriptor::getName).collect(Collectors.toList()));
        }
        boolean hasAssignment = mappings.stream()
                .anyMatch(m -> !m.isKey() && m.getSourceType() != MappingSourceType.SKIP);
        if (!hasAssignment) {
            throw new MappingException(MappingErrorKind.NOTHING_TO_UPDATE,
                    "Update mode requires at least one mapped column besides the key "
                            + keyColumn.getName());
        }
    }

    private void checkRequiredColumns(TableSchema schema, List<FieldMapping> written,
            Map<FieldMapping, ColumnDescriptor> columns) throws MappingException {
        Set<String> covered = new HashSet<>();
        for (FieldMapping mapping : written) {
            covered.add(columns.get(mapping).getName());
        }
        List<String> missing = new ArrayList<>();
        for (ColumnDescriptor column : schema.getColumns()) {
            if (column.isRequired() && !covered.contains(column.getName())) {
                missing.add(column.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MappingException(MappingErrorKind.REQUIRED_COLUMN_UNMAPPED,
                    "Required columns of " + schema.getIdentifier() + " are not mapped: "
                            + missing);
        }
    }
}
