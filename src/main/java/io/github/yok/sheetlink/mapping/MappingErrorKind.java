package io.github.yok.sheetlink.mapping;

/**
 * Reasons a mapping set is refused before any row is read.
 *
 * @author Yasuharu.Okawauchi
 */
public enum MappingErrorKind {
    NO_COLUMNS_MAPPED,
    UNKNOWN_TARGET_COLUMN,
    DUPLICATE_TARGET_COLUMN,
    UNKNOWN_SOURCE_FIELD,
    INVALID_COERCION_RULE,
    INVALID_CONSTANT,
    MISSING_KEY_MAPPING,
    AMBIGUOUS_KEY_MAPPING,
    INVALID_KEY_COLUMN,
    NOTHING_TO_UPDATE,
    REQUIRED_COLUMN_UNMAPPED
}
