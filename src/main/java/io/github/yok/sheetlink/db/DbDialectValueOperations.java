package io.github.yok.sheetlink.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Dialect operations for binding coerced values to statements.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectValueOperations {

    /**
     * Binds one value.
     *
     * @param statement target statement
     * @param index 1-based parameter index
     * @param value coerced value, may be {@code null}
     * @param jdbcType column type code, used for {@code null}
     * @throws SQLException if binding fails
     */
    void bindValue(PreparedStatement statement, int index, Object value, int jdbcType)
            throws SQLException;
}
