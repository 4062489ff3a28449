package io.github.yok.sheetlink.mapping;

/**
 * Write mode of an import run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ImportMode {

    // Add every accepted row as a new table row.
    INSERT,

    // Overwrite the mapped columns of the row whose key column equals the row's key value.
    UPDATE
}
