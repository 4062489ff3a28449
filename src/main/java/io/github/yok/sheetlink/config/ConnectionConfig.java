package io.github.yok.sheetlink.config;

import java.util.List;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Named database connections loaded from {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: crm
 *     url: jdbc:sqlserver://localhost:1433;databaseName=crm;encrypt=false
 *     user: importer
 *     password: secret
 *     driver-class: com.microsoft.sqlserver.jdbc.SQLServerDriver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections;

    /**
     * Finds a connection entry by its ID.
     *
     * @param id logical connection ID
     * @return matching entry, or empty
     */
    public Optional<Entry> findEntry(String id) {
        if (connections == null || id == null) {
            return Optional.empty();
        }
        return connections.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "crm")
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank to rely on JDBC 4 auto-loading
        private String driverClass;
    }
}
