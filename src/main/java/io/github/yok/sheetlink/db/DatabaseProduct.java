package io.github.yok.sheetlink.db;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Database products with a dedicated dialect handler, with the driver classes and the JDBC URL
 * prefix that identify them.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DatabaseProduct {

    SQLSERVER("jdbc:sqlserver:", "com.microsoft.sqlserver.jdbc.SQLServerDriver"),
    POSTGRESQL("jdbc:postgresql:", "org.postgresql.Driver"),
    MYSQL("jdbc:mysql:", "com.mysql.cj.jdbc.Driver", "com.mysql.jdbc.Driver"),
    ORACLE("jdbc:oracle:", "oracle.jdbc.OracleDriver", "oracle.jdbc.driver.OracleDriver"),
    H2("jdbc:h2:", "org.h2.Driver");

    private final String urlPrefix;
    private final List<String> driverClasses;

    DatabaseProduct(String urlPrefix, String... driverClasses) {
        this.urlPrefix = urlPrefix;
        this.driverClasses = Arrays.asList(driverClasses);
    }

    /**
     * Tells whether a driver class belongs to this product.
     *
     * @param driverClass fully qualified class name, compared case-insensitively
     * @return {@code true} on a match
     */
    boolean matchesDriverClass(String driverClass) {
        return driverClasses.stream().anyMatch(d -> d.equalsIgnoreCase(driverClass));
    }

    /**
     * Tells whether a JDBC URL addresses this product.
     *
     * @param jdbcUrl URL, compared case-insensitively
     * @return {@code true} on a match
     */
    boolean matchesUrl(String jdbcUrl) {
        return jdbcUrl.toLowerCase(Locale.ROOT).startsWith(urlPrefix);
    }
}
