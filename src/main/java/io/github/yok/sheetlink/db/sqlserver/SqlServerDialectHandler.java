package io.github.yok.sheetlink.db.sqlserver;

import io.github.yok.sheetlink.db.AbstractDbDialectHandler;
import io.github.yok.sheetlink.db.DatabaseProduct;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Dialect handler for SQL Server.
 *
 * <p>
 * Identifiers are bracket-quoted. A statement accepts at most 2100 parameters and a table value
 * constructor at most 1000 rows; the parameter limit is kept below the hard cap.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialectHandler extends AbstractDbDialectHandler {

    @Override
    public DatabaseProduct getProduct() {
        return DatabaseProduct.SQLSERVER;
    }

    /**
     * Fixes language and date order so that server-side conversions do not depend on the login's
     * defaults.
     *
     * @param connection JDBC connection
     * @throws SQLException if initialization fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET LANGUAGE us_english");
            st.execute("SET DATEFORMAT ymd");
        }
    }

    @Override
    public String getErrorCodesDatabaseName() {
        return "MS-SQL";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public int getMaxParametersPerStatement() {
        return 2000;
    }
}
