package io.github.yok.sheetlink.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SqlSession} over a {@link Connection}.
 *
 * <p>
 * Values are bound through the dialect handler. Prepared statements are cached per SQL text (least
 * recently used first out) because an import repeats the same few statements for every chunk.
 * Closing the session closes the cached statements and the connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcSqlSession implements SqlSession {

    static final int STATEMENT_CACHE_SIZE = 16;

    // Seconds to wait for Connection#isValid
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final Connection connection;

    @Getter
    private final DbDialectHandler dialect;

    private final Map<String, PreparedStatement> statements =
            new LinkedHashMap<>(STATEMENT_CACHE_SIZE, 0.75f, true);

    public JdbcSqlSession(Connection connection, DbDialectHandler dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    @Override
    public void begin() throws SQLException {
        if (connection.getAutoCommit()) {
            connection.setAutoCommit(false);
        }
    }

    @Override
    public void commit() throws SQLException {
        connection.commit();
    }

    @Override
    public void rollback() throws SQLException {
        connection.rollback();
    }

    @Override
    public void useAutoCommit() throws SQLException {
        if (!connection.getAutoCommit()) {
            connection.setAutoCommit(true);
        }
    }

    @Override
    public int executeUpdate(SqlStatement statement) throws SQLException {
        PreparedStatement ps = prepare(statement.getSql());
        bind(ps, statement.getParameters());
        return ps.executeUpdate();
    }

    @Override
    public int[] executeBatch(String sql, List<List<SqlParameter>> parameterSets)
            throws SQLException {
        PreparedStatement ps = prepare(sql);
        ps.clearBatch();
        for (List<SqlParameter> parameters : parameterSets) {
            bind(ps, parameters);
            ps.addBatch();
        }
        return ps.executeBatch();
    }

    @Override
    public boolean isValid() {
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.debug("Connection validation failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() throws SQLException {
        SQLException first = null;
        for (PreparedStatement ps : statements.values()) {
            try {
                ps.close();
            } catch (SQLException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        statements.clear();
        try {
            connection.close();
        } catch (SQLException e) {
            if (first != null) {
                e.addSuppressed(first);
            }
            throw e;
        }
        if (first != null) {
            throw first;
        }
    }

    private PreparedStatement prepare(String sql) throws SQLException {
        PreparedStatement ps = statements.get(sql);
        if (ps != null) {
            ps.clearParameters();
            return ps;
        }
        if (statements.size() >= STATEMENT_CACHE_SIZE) {
            Iterator<PreparedStatement> eldest = statements.values().iterator();
            PreparedStatement evicted = eldest.next();
            eldest.remove();
            evicted.close();
        }
        log.debug("Preparing SQL: {}", sql);
        ps = connection.prepareStatement(sql);
        statements.put(sql, ps);
        return ps;
    }

    private void bind(PreparedStatement ps, List<SqlParameter> parameters) throws SQLException {
        int index = 1;
        for (SqlParameter parameter : parameters) {
            dialect.bindValue(ps, index++, parameter.getValue(), parameter.getJdbcType());
        }
    }
}
