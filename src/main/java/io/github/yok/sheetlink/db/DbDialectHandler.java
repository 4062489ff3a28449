package io.github.yok.sheetlink.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * Composes focused contracts: session control, SQL grammar capabilities, and value binding.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations, DbDialectSqlOperations,
        DbDialectValueOperations {

    /**
     * Returns the product this handler serves.
     *
     * @return database product
     */
    DatabaseProduct getProduct();
}
