/**
 * Database access package.
 *
 * <p>
 * Absorbs database-specific differences (identifier quoting, statement limits, session settings,
 * value binding), reads table descriptions from the catalog, and wraps a JDBC connection as the
 * {@link io.github.yok.sheetlink.db.SqlSession} used by the batch executor.
 * </p>
 *
 * <p>
 * Database-specific implementations are located in subpackages {@code sqlserver},
 * {@code postgresql}, {@code mysql}, {@code oracle}, and {@code h2}.
 * </p>
 */
package io.github.yok.sheetlink.db;
