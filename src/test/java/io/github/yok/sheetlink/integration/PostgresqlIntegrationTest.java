package io.github.yok.sheetlink.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetlink.config.ConnectionConfig;
import io.github.yok.sheetlink.config.ImportConfig;
import io.github.yok.sheetlink.core.BatchOutcome;
import io.github.yok.sheetlink.core.BatchResult;
import io.github.yok.sheetlink.core.FailureReason;
import io.github.yok.sheetlink.core.ImportRequest;
import io.github.yok.sheetlink.core.ImportService;
import io.github.yok.sheetlink.db.DbDialectHandlerFactory;
import io.github.yok.sheetlink.mapping.CoercionRule;
import io.github.yok.sheetlink.mapping.FieldMapping;
import io.github.yok.sheetlink.mapping.ImportMode;
import io.github.yok.sheetlink.progress.CancellationToken;
import io.github.yok.sheetlink.progress.ProgressSink;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests for imports into a PostgreSQL container.
 *
 * <p>
 * Covers: multi-row inserts, constraint failures retried row by row, keyed updates and date
 * coercion through {@link ImportService}.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
public class PostgresqlIntegrationTest {

    @TempDir
    public Path tempDir;

    @Container
    private static final PostgreSQLContainer<?> postgres = createPostgres();

    private static PostgreSQLContainer<?> createPostgres() {
        PostgreSQLContainer<?> container = new PostgreSQLContainer<>("postgres:16-alpine");
        container.withDatabaseName("testdb").withUsername("test").withPassword("test");
        return container;
    }

    private ImportService service;
    private Path failureLog;

    @BeforeEach
    public void setup() throws Exception {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS customers");
            st.execute("CREATE TABLE customers (id integer PRIMARY KEY,"
                    + " name varchar(50) NOT NULL, amount numeric(12,2), created_on date,"
                    + " updated_at timestamp NOT NULL DEFAULT now())");
        }

        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("pg");
        entry.setUrl(postgres.getJdbcUrl());
        entry.setUser(postgres.getUsername());
        entry.setPassword(postgres.getPassword());
        entry.setDriverClass("org.postgresql.Driver");
        ConnectionConfig connectionConfig = new ConnectionConfig();
        connectionConfig.setConnections(Collections.singletonList(entry));

        failureLog = tempDir.resolve("failures.log");
        ImportConfig importConfig = new ImportConfig();
        importConfig.setChunkSize(3);
        importConfig.setFailureLog(failureLog.toString());
        service = new ImportService(connectionConfig, importConfig, new DbDialectHandlerFactory());
    }

    private static Connection openConnection() throws Exception {
        return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(),
                postgres.getPassword());
    }

    private Path csv(String content) throws Exception {
        Path file = tempDir.resolve("customers.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static ImportRequest.ImportRequestBuilder insertRequest(Path file) {
        return ImportRequest.builder().connectionId("pg").file(file).table("CUSTOMERS")
                .mode(ImportMode.INSERT).mapping(FieldMapping.field("Id", "id"))
                .mapping(FieldMapping.field("Name", "name"))
                .mapping(FieldMapping.field("Amount", "amount"))
                .mapping(FieldMapping.field("Date", "created_on")
                        .withCoercion(CoercionRule.builder().datePattern("DD/MM/YYYY").build()));
    }

    @Test
    public void execute_正常ケース_CSVを挿入する_型変換された値が登録されること() throws Exception {
        Path file = csv("Id,Name,Amount,Date\n1,Alice,\"1,234.50\",13/02/2024\n"
                + "2,Bob,3,01/03/2024\n3,Carol,,\n4,Dave,7.25,31/12/2023\n");

        BatchResult result = service.execute(insertRequest(file).build(), ProgressSink.NONE,
                new CancellationToken());

        assertEquals(BatchOutcome.COMPLETED, result.getOutcome());
        assertEquals(4, result.getSucceeded());
        try (Connection conn = openConnection(); Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(
                        "SELECT amount, created_on FROM customers WHERE id = 1")) {
            assertTrue(rs.next());
            assertEquals(0, new BigDecimal("1234.50").compareTo(rs.getBigDecimal(1)));
            assertEquals(LocalDate.of(2024, 2, 13), rs.getObject(2, LocalDate.class));
        }
    }

    @Test
    public void execute_正常ケース_重複キーを含む_重複行のみ失敗し失敗ログに記録されること() throws Exception {
        Path file = csv("Id,Name,Amount,Date\n1,Alice,1,\n2,Bob,2,\n1,Again,3,\n3,Carol,4,\n");

        BatchResult result = service.execute(insertRequest(file).build(), ProgressSink.NONE,
                new CancellationToken());

        assertEquals(3, result.getSucceeded());
        assertEquals(1, result.getFailed());
        assertEquals(FailureReason.CONSTRAINT_VIOLATION, result.getFailures().get(0).getReason());
        assertEquals(4, result.getFailures().get(0).getRowNumber());
        List<String> lines = Files.readAllLines(failureLog, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("| ROW | CONSTRAINT_VIOLATION | row=4 |"));
    }

    @Test
    public void execute_正常ケース_更新モード_キー一致行が更新され未存在キーが記録されること() throws Exception {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("INSERT INTO customers (id, name, amount) VALUES (1, 'Alice', 0),"
                    + " (2, 'Bob', 0)");
        }
        Path file = csv("Id,Amount\n2,50\n9,1\n");

        BatchResult result = service.execute(ImportRequest.builder().connectionId("pg")
                .file(file).table("public.customers").mode(ImportMode.UPDATE)
                .mapping(FieldMapping.field("Id", "ID").asKey())
                .mapping(FieldMapping.field("Amount", "AMOUNT")).build(), ProgressSink.NONE,
                new CancellationToken());

        assertEquals(1, result.getSucceeded());
        assertEquals(FailureReason.KEY_NOT_FOUND, result.getFailures().get(0).getReason());
        try (Connection conn = openConnection(); Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT amount FROM customers ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals(0, BigDecimal.ZERO.compareTo(rs.getBigDecimal(1)));
            assertTrue(rs.next());
            assertEquals(0, new BigDecimal("50").compareTo(rs.getBigDecimal(1)));
        }
    }
}
