package io.github.yok.sheetlink.mapping;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * User-declared rule that fills one target column.
 *
 * <p>
 * Instances are immutable; {@link #asKey()} and {@link #withCoercion(CoercionRule)} return
 * copies.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FieldMapping {

    private final String targetColumn;
    private final MappingSourceType sourceType;
    private final String sourceField;
    private final Object constantValue;
    private final CoercionRule coercion;
    private final boolean key;

    /**
     * Maps a source field to a target column.
     *
     * @param sourceField header name in the source
     * @param targetColumn column name in the target table
     * @return mapping
     */
    public static FieldMapping field(String sourceField, String targetColumn) {
        Validate.notBlank(sourceField, "sourceField must not be blank");
        Validate.notBlank(targetColumn, "targetColumn must not be blank");
        return new FieldMapping(targetColumn, MappingSourceType.FIELD, sourceField, null,
                CoercionRule.DEFAULT, false);
    }

    /**
     * Writes the same value into a target column for every row.
     *
     * @param targetColumn column name in the target table
     * @param value literal value, coerced like a source value
     * @return mapping
     */
    public static FieldMapping constant(String targetColumn, Object value) {
        Validate.notBlank(targetColumn, "targetColumn must not be blank");
        return new FieldMapping(targetColumn, MappingSourceType.CONSTANT, null, value,
                CoercionRule.DEFAULT, false);
    }

    /**
     * Marks a target column as deliberately not written.
     *
     * @param targetColumn column name in the target table
     * @return mapping
     */
    public static FieldMapping skip(String targetColumn) {
        Validate.notBlank(targetColumn, "targetColumn must not be blank");
        return new FieldMapping(targetColumn, MappingSourceType.SKIP, null, null,
                CoercionRule.DEFAULT, false);
    }

    /**
     * Returns a copy flagged as the update key.
     *
     * @return key mapping
     */
    public FieldMapping asKey() {
        return new FieldMapping(targetColumn, sourceType, sourceField, constantValue, coercion,
                true);
    }

    /**
     * Returns a copy with the given coercion rule.
     *
     * @param rule coercion rule, {@code null} for defaults
     * @return mapping
     */
    public FieldMapping withCoercion(CoercionRule rule) {
        return new FieldMapping(targetColumn, sourceType, sourceField, constantValue,
                rule == null ? CoercionRule.DEFAULT : rule, key);
    }
}
