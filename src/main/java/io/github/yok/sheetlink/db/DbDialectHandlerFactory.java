package io.github.yok.sheetlink.db;

import io.github.yok.sheetlink.config.ConnectionConfig;
import io.github.yok.sheetlink.db.h2.H2DialectHandler;
import io.github.yok.sheetlink.db.mysql.MySqlDialectHandler;
import io.github.yok.sheetlink.db.oracle.OracleDialectHandler;
import io.github.yok.sheetlink.db.postgresql.PostgresqlDialectHandler;
import io.github.yok.sheetlink.db.sqlserver.SqlServerDialectHandler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the database type.
 *
 * <p>
 * The handler is resolved per {@link ConnectionConfig.Entry} using
 * {@code connections[].driver-class} first and the JDBC URL as a fallback. Handlers hold no
 * connection; callers pass their own connection to the handler's operations.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates a {@link DbDialectHandler} based on the provided connection entry.
     *
     * <p>
     * Supported database types (resolved from {@code driver-class} or JDBC URL):
     * </p>
     * <ul>
     * <li>{@code SQLSERVER}: instantiate {@link SqlServerDialectHandler}</li>
     * <li>{@code POSTGRESQL}: instantiate {@link PostgresqlDialectHandler}</li>
     * <li>{@code MYSQL}: instantiate {@link MySqlDialectHandler}</li>
     * <li>{@code ORACLE}: instantiate {@link OracleDialectHandler}</li>
     * <li>{@code H2}: instantiate {@link H2DialectHandler}</li>
     * </ul>
     *
     * @param entry connection information (URL, user, password, ID, etc.)
     * @return dialect handler
     * @throws IllegalStateException if the database type cannot be determined
     */
    public DbDialectHandler create(ConnectionConfig.Entry entry) {
        DatabaseProduct product;
        try {
            product = resolveProduct(entry);
        } catch (IllegalArgumentException e) {
            log.error("Invalid dialect resolution input", e);
            throw new IllegalStateException(e.getMessage(), e);
        }
        log.debug("Resolved dialect {} for connection id={}", product, entry.getId());
        switch (product) {
            case SQLSERVER:
                return new SqlServerDialectHandler();
            case POSTGRESQL:
                return new PostgresqlDialectHandler();
            case MYSQL:
                return new MySqlDialectHandler();
            case ORACLE:
                return new OracleDialectHandler();
            default:
                return new H2DialectHandler();
        }
    }

    /**
     * Resolves the database type for a connection entry.
     *
     * <p>
     * Resolution priority is {@code driver-class} first, then JDBC URL.
     * </p>
     *
     * @param entry connection entry
     * @return resolved database type
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    DatabaseProduct resolveProduct(ConnectionConfig.Entry entry) {
        String driverClass = StringUtils.trimToNull(entry.getDriverClass());
        if (driverClass != null) {
            for (DatabaseProduct product : DatabaseProduct.values()) {
                if (product.matchesDriverClass(driverClass)) {
                    return product;
                }
            }
        }
        String url = StringUtils.trimToNull(entry.getUrl());
        if (url != null) {
            for (DatabaseProduct product : DatabaseProduct.values()) {
                if (product.matchesUrl(url)) {
                    return product;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported database dialect for connection id="
                + entry.getId() + " (driver-class=" + entry.getDriverClass() + ", url="
                + entry.getUrl() + ")");
    }
}
