package io.github.yok.sheetlink.core;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

/**
 * Maps JDBC errors to {@link FailureReason}s.
 *
 * <p>
 * Vendor error codes are translated with Spring's {@link SQLErrorCodeSQLExceptionTranslator}
 * ({@code sql-error-codes.xml}), which falls back to SQLState classes for unknown codes. Connection
 * classes of exceptions and SQLState class {@code 08} are recognized before translation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SqlErrorClassifier {

    private final SQLExceptionTranslator translator;

    /**
     * Creates a classifier.
     *
     * @param errorCodesDatabaseName database name in {@code sql-error-codes.xml}, e.g.
     *        {@code MS-SQL}
     */
    public SqlErrorClassifier(String errorCodesDatabaseName) {
        this.translator = new SQLErrorCodeSQLExceptionTranslator(errorCodesDatabaseName);
    }

    /**
     * Classifies an error.
     *
     * @param e JDBC error, may be {@code null}
     * @return failure reason, {@link FailureReason#DATABASE_ERROR} when nothing more specific applies
     */
    public FailureReason classify(SQLException e) {
        if (e == null) {
            return FailureReason.DATABASE_ERROR;
        }
        if (isConnectionError(e)) {
            return FailureReason.CONNECTION_LOST;
        }
        DataAccessException translated = translator.translate("import", null, e);
        if (translated == null) {
            return FailureReason.DATABASE_ERROR;
        }
        log.debug("Translated SQL error {} (SQLState={}) to {}", e.getErrorCode(), e.getSQLState(),
                translated.getClass().getSimpleName());
        if (translated instanceof DataIntegrityViolationException) {
            return FailureReason.CONSTRAINT_VIOLATION;
        }
        if (translated instanceof PessimisticLockingFailureException
                || translated instanceof CannotAcquireLockException
                || translated instanceof QueryTimeoutException) {
            return FailureReason.LOCK_TIMEOUT;
        }
        if (translated instanceof DataAccessResourceFailureException
                || translated instanceof TransientDataAccessResourceException
                || translated instanceof RecoverableDataAccessException) {
            return FailureReason.CONNECTION_LOST;
        }
        return FailureReason.DATABASE_ERROR;
    }

    private static boolean isConnectionError(SQLException e) {
        if (e instanceof SQLNonTransientConnectionException
                || e instanceof SQLTransientConnectionException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }
}
