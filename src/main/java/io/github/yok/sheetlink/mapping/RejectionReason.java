package io.github.yok.sheetlink.mapping;

/**
 * Reasons a single row is refused while it is projected onto the target columns.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RejectionReason {

    // A value cannot be converted to its column's type
    TYPE_COERCION_FAILED,

    // A non-nullable column would receive null
    REQUIRED_VALUE_MISSING
}
