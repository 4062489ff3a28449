package io.github.yok.sheetlink.db;

import io.github.yok.sheetlink.schema.TableIdentifier;

/**
 * Dialect operations for SQL grammar and statement limits.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectSqlOperations {

    /**
     * Quotes an identifier if needed by the DB dialect.
     *
     * @param identifier raw identifier in catalog spelling
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Renders a possibly qualified table name with every part quoted.
     *
     * @param table table identifier in catalog spelling
     * @return SQL table reference
     */
    String qualifiedTableName(TableIdentifier table);

    /**
     * Returns whether {@code INSERT ... VALUES (...), (...)} is supported.
     *
     * @return {@code true} if multi-row inserts can be used
     */
    boolean supportsMultiRowInsert();

    /**
     * Returns the largest number of bind parameters accepted in one statement.
     *
     * @return parameter limit
     */
    int getMaxParametersPerStatement();

    /**
     * Returns the largest number of row constructors accepted in one multi-row insert.
     *
     * @return row limit
     */
    int getMaxRowsPerInsert();
}
