package io.github.yok.sheetlink.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Dialect operations for JDBC session preparation.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectConnectionOperations {

    /**
     * Applies session settings required before the import writes rows.
     *
     * @param connection JDBC connection
     * @throws SQLException if initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;

    /**
     * Returns the database name understood by Spring's {@code sql-error-codes.xml}, used to
     * classify vendor error codes.
     *
     * @return name such as {@code MS-SQL} or {@code PostgreSQL}
     */
    String getErrorCodesDatabaseName();
}
