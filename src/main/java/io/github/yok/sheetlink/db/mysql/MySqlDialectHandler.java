package io.github.yok.sheetlink.db.mysql;

import io.github.yok.sheetlink.db.AbstractDbDialectHandler;
import io.github.yok.sheetlink.db.DatabaseProduct;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Dialect handler for MySQL.
 *
 * <p>
 * Identifiers are backtick-quoted. Databases are exposed as JDBC catalogs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler extends AbstractDbDialectHandler {

    @Override
    public DatabaseProduct getProduct() {
        return DatabaseProduct.MYSQL;
    }

    /**
     * Pins the session time zone so that DATETIME and TIMESTAMP values are stored as given.
     *
     * @param connection JDBC connection
     * @throws SQLException if initialization fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
        }
    }

    @Override
    public String getErrorCodesDatabaseName() {
        return "MySQL";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public int getMaxParametersPerStatement() {
        return 65535;
    }
}
