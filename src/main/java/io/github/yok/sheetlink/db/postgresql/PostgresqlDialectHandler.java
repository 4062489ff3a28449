package io.github.yok.sheetlink.db.postgresql;

import io.github.yok.sheetlink.db.AbstractDbDialectHandler;
import io.github.yok.sheetlink.db.DatabaseProduct;

/**
 * Dialect handler for PostgreSQL.
 *
 * <p>
 * The wire protocol limits a statement to 32767 bind parameters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler extends AbstractDbDialectHandler {

    @Override
    public DatabaseProduct getProduct() {
        return DatabaseProduct.POSTGRESQL;
    }

    @Override
    public String getErrorCodesDatabaseName() {
        return "PostgreSQL";
    }

    @Override
    public int getMaxParametersPerStatement() {
        return 32767;
    }
}
