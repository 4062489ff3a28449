/**
 * Catalog model of the target table.
 *
 * <p>
 * Holds the immutable descriptions of a table and its columns. The descriptions are read from the
 * database catalog by {@code io.github.yok.sheetlink.db.TableSchemaLoader} at the start of every
 * run and never cached.
 * </p>
 */
package io.github.yok.sheetlink.schema;
