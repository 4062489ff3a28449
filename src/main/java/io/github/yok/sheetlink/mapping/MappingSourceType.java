package io.github.yok.sheetlink.mapping;

/**
 * Where the value of a mapped column comes from.
 *
 * @author Yasuharu.Okawauchi
 */
public enum MappingSourceType {

    // A field (column) of the source sheet
    FIELD,

    // The same literal value for every row
    CONSTANT,

    // The column is deliberately not written
    SKIP
}
