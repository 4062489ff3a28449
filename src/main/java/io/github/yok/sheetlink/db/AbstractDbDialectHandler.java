package io.github.yok.sheetlink.db;

import io.github.yok.sheetlink.schema.TableIdentifier;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Defaults shared by the dialect handlers: ANSI double-quoted identifiers, multi-row inserts of up
 * to 1000 rows, no session preparation, and driver-inferred binding.
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class AbstractDbDialectHandler implements DbDialectHandler {

    /**
     * Wraps an identifier in double quotes, doubling embedded quotes.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String qualifiedTableName(TableIdentifier table) {
        StringBuilder sb = new StringBuilder();
        if (table.getCatalog() != null) {
            sb.append(quoteIdentifier(table.getCatalog())).append('.');
        }
        if (table.getSchema() != null) {
            sb.append(quoteIdentifier(table.getSchema())).append('.');
        }
        return sb.append(quoteIdentifier(table.getTable())).toString();
    }

    @Override
    public boolean supportsMultiRowInsert() {
        return true;
    }

    @Override
    public int getMaxRowsPerInsert() {
        return 1000;
    }

    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        // no session settings by default
    }

    /**
     * Binds {@code null} with the column type, {@code byte[]} as bytes, and anything else through
     * {@link PreparedStatement#setObject(int, Object)} (JDBC 4.2 handles {@code java.time}).
     */
    @Override
    public void bindValue(PreparedStatement statement, int index, Object value, int jdbcType)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, jdbcType);
        } else if (value instanceof byte[]) {
            statement.setBytes(index, (byte[]) value);
        } else {
            statement.setObject(index, value);
        }
    }
}
