package io.github.yok.sheetlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetlink.config.ConnectionConfig;
import io.github.yok.sheetlink.config.ImportConfig;
import io.github.yok.sheetlink.db.DbDialectHandlerFactory;
import io.github.yok.sheetlink.db.TableSchemaLoader;
import io.github.yok.sheetlink.mapping.FieldMapping;
import io.github.yok.sheetlink.mapping.ImportMode;
import io.github.yok.sheetlink.mapping.MappingErrorKind;
import io.github.yok.sheetlink.mapping.MappingException;
import io.github.yok.sheetlink.mapping.MappingResolver;
import io.github.yok.sheetlink.parser.SourceReadException;
import io.github.yok.sheetlink.parser.SourceReaderFactory;
import io.github.yok.sheetlink.progress.CancellationToken;
import io.github.yok.sheetlink.progress.ProgressChannel;
import io.github.yok.sheetlink.progress.ProgressSink;
import io.github.yok.sheetlink.schema.SchemaNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end tests for {@link ImportService} on an in-memory H2 database and CSV sources.
 */
class ImportServiceTest {

    @TempDir
    Path tempDir;

    private String url;
    private Connection keepAlive;
    private ConnectionConfig connectionConfig;
    private ImportConfig importConfig;
    private final List<FailureEvent> failureEvents = new ArrayList<>();
    private ImportService service;

    @BeforeEach
    void setUp() throws Exception {
        url = "jdbc:h2:mem:service_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        keepAlive = DriverManager.getConnection(url, "sa", "");
        try (Statement st = keepAlive.createStatement()) {
            st.execute("CREATE TABLE CUSTOMERS (ID INT PRIMARY KEY, NAME VARCHAR(50) NOT NULL,"
                    + " AMOUNT DECIMAL(12,2))");
        }

        connectionConfig = new ConnectionConfig();
        connectionConfig.setConnections(Collections.singletonList(entry("local", url)));
        importConfig = new ImportConfig();
        importConfig.setChunkSize(2);
        service = newService();
    }

    @AfterEach
    void tearDown() throws Exception {
        try (Statement st = keepAlive.createStatement()) {
            st.execute("SHUTDOWN");
        }
        keepAlive.close();
    }

    private ImportService newService() {
        return new ImportService(connectionConfig, importConfig, new DbDialectHandlerFactory(),
                new TableSchemaLoader(), new SourceReaderFactory(), new MappingResolver(Locale.US),
                failureEvents::add);
    }

    private static ConnectionConfig.Entry entry(String id, String url) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId(id);
        entry.setUrl(url);
        entry.setUser("sa");
        entry.setPassword("");
        return entry;
    }

    private Path csv(String content) throws Exception {
        Path file = tempDir.resolve("customers.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private ImportRequest.ImportRequestBuilder insertRequest(Path file) {
        return ImportRequest.builder().operationId("op-svc").connectionId("local").file(file)
                .table("customers").mode(ImportMode.INSERT)
                .mapping(FieldMapping.field("ID", "ID")).mapping(FieldMapping.field("Name", "NAME"))
                .mapping(FieldMapping.field("Amount", "AMOUNT"));
    }

    private int count() throws Exception {
        try (Statement st = keepAlive.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM CUSTOMERS")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void execute_正常ケース_CSVを挿入する_全行が登録され結果が通知されること() throws Exception {
        Path file = csv("ID,Name,Amount\n1,Alice,10.50\n2,Bob,3\n3,Carol,7.25\n");
        ProgressChannel channel = new ProgressChannel(8);

        BatchResult result =
                service.execute(insertRequest(file).build(), channel, new CancellationToken());

        assertEquals(BatchOutcome.COMPLETED, result.getOutcome());
        assertEquals("op-svc", result.getOperationId());
        assertEquals(3, result.getSucceeded());
        assertEquals(3, count());
        assertEquals(2, channel.drain().size());
        assertEquals(result, channel.awaitResult(1, TimeUnit.SECONDS));
        assertTrue(failureEvents.isEmpty());
    }

    @Test
    void execute_正常ケース_接続IDを省略し接続が1件_その接続が使われること() throws Exception {
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        BatchResult result = service.execute(insertRequest(file).connectionId(null).chunkSize(10)
                .operationId(null).build(), ProgressSink.NONE, new CancellationToken());

        assertEquals(1, result.getSucceeded());
        assertEquals(8, result.getOperationId().length());
    }

    @Test
    void execute_正常ケース_更新モード_キーで一致した行が更新されること() throws Exception {
        try (Statement st = keepAlive.createStatement()) {
            st.execute("INSERT INTO CUSTOMERS VALUES (1, 'Alice', 0), (2, 'Bob', 0)");
        }
        Path file = csv("ID,Amount\n2,99\n5,1\n");

        BatchResult result = service.execute(ImportRequest.builder().connectionId("local")
                .file(file).table("PUBLIC.CUSTOMERS").mode(ImportMode.UPDATE)
                .mapping(FieldMapping.field("ID", "ID").asKey())
                .mapping(FieldMapping.field("Amount", "AMOUNT")).build(), ProgressSink.NONE,
                new CancellationToken());

        assertEquals(1, result.getSucceeded());
        assertEquals(1, result.getFailed());
        assertEquals(FailureReason.KEY_NOT_FOUND, result.getFailures().get(0).getReason());
        try (Statement st = keepAlive.createStatement();
                ResultSet rs = st.executeQuery("SELECT AMOUNT FROM CUSTOMERS WHERE ID = 2")) {
            rs.next();
            assertEquals(99, rs.getInt(1));
        }
    }

    @Test
    void execute_異常ケース_複合主キーの1列で更新する_MappingExceptionが送出され行が変わらないこと() throws Exception {
        try (Statement st = keepAlive.createStatement()) {
            st.execute("CREATE TABLE PAIRS (A INT, B INT, V VARCHAR(10), PRIMARY KEY (A, B))");
            st.execute("INSERT INTO PAIRS VALUES (1, 1, 'old'), (1, 2, 'old'), (1, 3, 'old')");
        }
        Path file = csv("A,V\n1,new\n");

        MappingException ex = assertThrows(MappingException.class,
                () -> service.execute(ImportRequest.builder().connectionId("local").file(file)
                        .table("PAIRS").mode(ImportMode.UPDATE)
                        .mapping(FieldMapping.field("A", "A").asKey())
                        .mapping(FieldMapping.field("V", "V")).build(), ProgressSink.NONE,
                        new CancellationToken()));

        assertEquals(MappingErrorKind.INVALID_KEY_COLUMN, ex.getKind());
        try (Statement st = keepAlive.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM PAIRS WHERE V = 'old'")) {
            rs.next();
            assertEquals(3, rs.getInt(1));
        }
    }

    @Test
    void execute_異常ケース_未知の接続ID_ConnectionSetupExceptionが送出され失敗ログに記録されること() throws Exception {
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        ConnectionSetupException ex = assertThrows(ConnectionSetupException.class,
                () -> service.execute(insertRequest(file).connectionId("nope").build(),
                        ProgressSink.NONE, new CancellationToken()));

        assertEquals(ConnectionSetupException.Kind.UNKNOWN_CONNECTION, ex.getKind());
        assertEquals(1, failureEvents.size());
        assertEquals(FailureEvent.Severity.FATAL, failureEvents.get(0).getSeverity());
        assertEquals("UNKNOWN_CONNECTION", failureEvents.get(0).getCode());
        assertEquals("op-svc", failureEvents.get(0).getOperationId());
    }

    @Test
    void execute_異常ケース_接続IDを省略し接続が複数_ConnectionSetupExceptionが送出されること() throws Exception {
        connectionConfig.setConnections(Arrays.asList(entry("a", url), entry("b", url)));
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        ConnectionSetupException ex = assertThrows(ConnectionSetupException.class,
                () -> service.execute(insertRequest(file).connectionId(null).build(),
                        ProgressSink.NONE, new CancellationToken()));

        assertEquals(ConnectionSetupException.Kind.UNKNOWN_CONNECTION, ex.getKind());
    }

    @Test
    void execute_異常ケース_ドライバクラスが存在しない_接続失敗となること() throws Exception {
        ConnectionConfig.Entry broken = entry("local", url);
        broken.setDriverClass("org.example.MissingDriver");
        connectionConfig.setConnections(Collections.singletonList(broken));
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        ConnectionSetupException ex = assertThrows(ConnectionSetupException.class,
                () -> service.execute(insertRequest(file).build(), ProgressSink.NONE,
                        new CancellationToken()));

        assertEquals(ConnectionSetupException.Kind.CONNECTION_FAILED, ex.getKind());
        assertEquals("CONNECTION_FAILED", failureEvents.get(0).getCode());
    }

    @Test
    void execute_異常ケース_方言を判定できないURL_接続失敗となること() throws Exception {
        connectionConfig
                .setConnections(Collections.singletonList(entry("local", "jdbc:unknown:db")));
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        ConnectionSetupException ex = assertThrows(ConnectionSetupException.class,
                () -> service.execute(insertRequest(file).build(), ProgressSink.NONE,
                        new CancellationToken()));

        assertEquals(ConnectionSetupException.Kind.CONNECTION_FAILED, ex.getKind());
    }

    @Test
    void execute_異常ケース_存在しないテーブル_SchemaNotFoundExceptionが送出されること() throws Exception {
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        assertThrows(SchemaNotFoundException.class,
                () -> service.execute(insertRequest(file).table("MISSING").build(),
                        ProgressSink.NONE, new CancellationToken()));

        assertEquals("SCHEMA_NOT_FOUND", failureEvents.get(0).getCode());
    }

    @Test
    void execute_異常ケース_不正なテーブル名_SchemaNotFoundExceptionが送出されること() throws Exception {
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        assertThrows(SchemaNotFoundException.class,
                () -> service.execute(insertRequest(file).table("a.b.c.d").build(),
                        ProgressSink.NONE, new CancellationToken()));
    }

    @Test
    void execute_異常ケース_ヘッダにない項目を対応付ける_MappingExceptionが送出され何も登録されないこと() throws Exception {
        Path file = csv("ID,Name\n1,Alice\n");

        MappingException ex = assertThrows(MappingException.class,
                () -> service.execute(insertRequest(file).build(), ProgressSink.NONE,
                        new CancellationToken()));

        assertEquals(MappingErrorKind.UNKNOWN_SOURCE_FIELD, ex.getKind());
        assertEquals("UNKNOWN_SOURCE_FIELD", failureEvents.get(0).getCode());
        assertEquals(0, count());
    }

    @Test
    void execute_異常ケース_存在しないファイル_SourceReadExceptionが送出されること() throws Exception {
        Path file = tempDir.resolve("missing.csv");

        assertThrows(SourceReadException.class,
                () -> service.execute(insertRequest(file).build(), ProgressSink.NONE,
                        new CancellationToken()));

        assertEquals(1, failureEvents.size());
    }

    @Test
    void execute_異常ケース_チャンクサイズ0を指定する_IllegalArgumentExceptionが送出されること() throws Exception {
        Path file = csv("ID,Name,Amount\n1,Alice,1\n");

        assertThrows(IllegalArgumentException.class,
                () -> service.execute(insertRequest(file).chunkSize(0).build(), ProgressSink.NONE,
                        new CancellationToken()));
    }

    @Test
    void listSheets_正常ケース_CSVファイル_ファイル名のシートが1件返ること() throws Exception {
        Path file = csv("ID\n1\n");

        assertEquals(Collections.singletonList("customers"), service.listSheets(file));
    }
}
