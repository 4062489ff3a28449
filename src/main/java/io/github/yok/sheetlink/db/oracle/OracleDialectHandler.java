package io.github.yok.sheetlink.db.oracle;

import io.github.yok.sheetlink.db.AbstractDbDialectHandler;
import io.github.yok.sheetlink.db.DatabaseProduct;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Dialect handler for Oracle.
 *
 * <p>
 * Oracle has no multi-row {@code VALUES} list, so chunks are written as JDBC batches. Booleans are
 * bound as {@code 1}/{@code 0} for {@code NUMBER(1)} flag columns.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class OracleDialectHandler extends AbstractDbDialectHandler {

    @Override
    public DatabaseProduct getProduct() {
        return DatabaseProduct.ORACLE;
    }

    /**
     * Fixes the numeric characters so that server-side conversions use a dot as decimal
     * separator.
     *
     * @param connection JDBC connection
     * @throws SQLException if initialization fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("ALTER SESSION SET NLS_NUMERIC_CHARACTERS = '.,'");
        }
    }

    @Override
    public String getErrorCodesDatabaseName() {
        return "Oracle";
    }

    @Override
    public boolean supportsMultiRowInsert() {
        return false;
    }

    @Override
    public int getMaxParametersPerStatement() {
        return 65535;
    }

    @Override
    public void bindValue(PreparedStatement statement, int index, Object value, int jdbcType)
            throws SQLException {
        if (value instanceof Boolean) {
            statement.setInt(index, ((Boolean) value) ? 1 : 0);
            return;
        }
        super.bindValue(statement, index, value, jdbcType);
    }
}
