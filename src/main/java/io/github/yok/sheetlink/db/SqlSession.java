package io.github.yok.sheetlink.db;

import java.sql.SQLException;
import java.util.List;

/**
 * Connection handle used by the batch executor.
 *
 * <p>
 * Separates transaction control and statement execution from {@link java.sql.Connection} so that
 * the executor can be exercised without a database. A session is used by one thread at a time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SqlSession extends AutoCloseable {

    /**
     * Returns the dialect of the connected database.
     *
     * @return dialect handler
     */
    DbDialectHandler getDialect();

    /**
     * Starts an explicit transaction (disables autocommit).
     *
     * @throws SQLException if the mode cannot be changed
     */
    void begin() throws SQLException;

    /**
     * Commits the current transaction.
     *
     * @throws SQLException if the commit fails
     */
    void commit() throws SQLException;

    /**
     * Rolls back the current transaction.
     *
     * @throws SQLException if the rollback fails
     */
    void rollback() throws SQLException;

    /**
     * Switches to autocommit mode; every statement commits on its own.
     *
     * @throws SQLException if the mode cannot be changed
     */
    void useAutoCommit() throws SQLException;

    /**
     * Executes one statement.
     *
     * @param statement SQL and bind values
     * @return update count
     * @throws SQLException if execution fails
     */
    int executeUpdate(SqlStatement statement) throws SQLException;

    /**
     * Executes one SQL text once per parameter list as a JDBC batch.
     *
     * @param sql parameterized SQL
     * @param parameterSets bind values per execution
     * @return update counts per execution
     * @throws SQLException if any execution fails
     */
    int[] executeBatch(String sql, List<List<SqlParameter>> parameterSets) throws SQLException;

    /**
     * Returns whether the underlying connection is still usable.
     *
     * @return {@code false} when the connection is closed or does not answer
     */
    boolean isValid();

    @Override
    void close() throws SQLException;
}
