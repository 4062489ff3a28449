package io.github.yok.sheetlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.sheetlink.ImportSetupException;
import io.github.yok.sheetlink.config.ConnectionConfig;
import io.github.yok.sheetlink.config.ImportConfig;
import io.github.yok.sheetlink.db.DbDialectHandler;
import io.github.yok.sheetlink.db.DbDialectHandlerFactory;
import io.github.yok.sheetlink.db.JdbcSqlSession;
import io.github.yok.sheetlink.db.TableSchemaLoader;
import io.github.yok.sheetlink.mapping.CompiledMapping;
import io.github.yok.sheetlink.mapping.MappingResolver;
import io.github.yok.sheetlink.parser.SourceCursor;
import io.github.yok.sheetlink.parser.SourceReadException;
import io.github.yok.sheetlink.parser.SourceReaderFactory;
import io.github.yok.sheetlink.progress.CancellationToken;
import io.github.yok.sheetlink.progress.ProgressSink;
import io.github.yok.sheetlink.schema.SchemaNotFoundException;
import io.github.yok.sheetlink.schema.TableIdentifier;
import io.github.yok.sheetlink.schema.TableSchema;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs imports end to end.
 *
 * <p>
 * For each run this service:
 * </p>
 * <ol>
 * <li>resolves the connection profile and its dialect, and opens a dedicated JDBC connection,</li>
 * <li>reads the target table's schema from the catalog,</li>
 * <li>opens the source sheet and compiles the mapping against its header,</li>
 * <li>hands everything to a fresh {@link BatchExecutor},</li>
 * <li>closes the source and the connection.</li>
 * </ol>
 *
 * <p>
 * Setup failures are written to the failure log as {@code FATAL} events and rethrown; nothing has
 * been written to the table at that point. Runs are independent: several may execute at once on
 * different threads, each with its own connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ImportService {

    private final ConnectionConfig connectionConfig;
    private final ImportConfig importConfig;
    private final DbDialectHandlerFactory dialectFactory;
    private final TableSchemaLoader schemaLoader;
    private final SourceReaderFactory readerFactory;
    private final MappingResolver mappingResolver;
    private final FailureLog failureLog;

    /**
     * Creates the service from the application configuration.
     *
     * @param connectionConfig connection profiles
     * @param importConfig import settings
     * @param dialectFactory dialect resolution
     */
    @Autowired
    public ImportService(ConnectionConfig connectionConfig, ImportConfig importConfig,
            DbDialectHandlerFactory dialectFactory) {
        this(connectionConfig, importConfig, dialectFactory, new TableSchemaLoader(),
                new SourceReaderFactory(csvDelimiter(importConfig),
                        Charset.forName(importConfig.getCsv().getCharset())),
                new MappingResolver(Locale.forLanguageTag(importConfig.getLocale())),
                new FileFailureLog(new File(importConfig.getFailureLog())));
    }

    ImportService(ConnectionConfig connectionConfig, ImportConfig importConfig,
            DbDialectHandlerFactory dialectFactory, TableSchemaLoader schemaLoader,
            SourceReaderFactory readerFactory, MappingResolver mappingResolver,
            FailureLog failureLog) {
        this.connectionConfig = connectionConfig;
        this.importConfig = importConfig;
        this.dialectFactory = dialectFactory;
        this.schemaLoader = schemaLoader;
        this.readerFactory = readerFactory;
        this.mappingResolver = mappingResolver;
        this.failureLog = failureLog;
    }

    /**
     * Runs one import.
     *
     * @param request run parameters
     * @param sink progress receiver
     * @param token cancellation flag
     * @return final result, also passed to {@link ProgressSink#onFinished(BatchResult)}
     * @throws ImportSetupException if the run cannot start (unknown or unreachable connection,
     *         missing table, unreadable source, invalid mapping)
     */
    public BatchResult execute(ImportRequest request, ProgressSink sink, CancellationToken token)
            throws ImportSetupException {
        Validate.notNull(request.getFile(), "file must not be null.");
        Validate.notBlank(request.getTable(), "table must not be blank.");
        Validate.notNull(request.getMode(), "mode must not be null.");
        int chunkSize = request.getChunkSize() != null ? request.getChunkSize()
                : importConfig.getChunkSize();
        Preconditions.checkArgument(chunkSize > 0, "chunk size must be positive: %s", chunkSize);

        String operationId = StringUtils.defaultIfBlank(request.getOperationId(),
                UUID.randomUUID().toString().substring(0, 8));
        log.info("[op={}] Import requested: file={}, sheet={}, table={}, mode={}, connection={}",
                operationId, request.getFile(), request.getSheetName(), request.getTable(),
                request.getMode(), request.getConnectionId());

        try {
            ConnectionConfig.Entry entry = resolveEntry(request.getConnectionId());
            DbDialectHandler dialect = resolveDialect(entry);
            Connection connection = openConnection(entry, dialect);
            JdbcSqlSession session = new JdbcSqlSession(connection, dialect);
            try {
                TableSchema schema =
                        schemaLoader.loadSchema(connection, parseTable(request.getTable()));
                SourceCursor cursor = readerFactory.open(request.getFile(), request.getSheetName());
                try {
                    CompiledMapping mapping = mappingResolver.compile(schema, cursor.getHeader(),
                            request.getMappings(), request.getMode());
                    return new BatchExecutor(operationId, failureLog).run(session, mapping,
                            cursor, request.getMode(), chunkSize, sink, token);
                } finally {
                    closeCursor(operationId, cursor);
                }
            } finally {
                closeSession(operationId, session);
            }
        } catch (ImportSetupException e) {
            log.error("[op={}] Import could not start ({}): {}", operationId, e.getErrorCode(),
                    e.getMessage());
            failureLog.append(FailureEvent.fatal(operationId, e.getErrorCode(), null,
                    e.getMessage()));
            throw e;
        }
    }

    /**
     * Lists the sheets of a source file.
     *
     * @param file source file
     * @return sheet names in workbook order
     * @throws SourceReadException if the file cannot be read
     */
    public List<String> listSheets(Path file) throws SourceReadException {
        return readerFactory.listSheets(file);
    }

    private ConnectionConfig.Entry resolveEntry(String connectionId)
            throws ConnectionSetupException {
        if (connectionId == null) {
            List<ConnectionConfig.Entry> entries = connectionConfig.getConnections();
            if (entries != null && entries.size() == 1) {
                return entries.get(0);
            }
            throw new ConnectionSetupException(ConnectionSetupException.Kind.UNKNOWN_CONNECTION,
                    "No connection ID given and the configuration does not hold exactly one"
                            + " connection");
        }
        return connectionConfig.findEntry(connectionId)
                .orElseThrow(() -> new ConnectionSetupException(
                        ConnectionSetupException.Kind.UNKNOWN_CONNECTION,
                        "Unknown connection ID: " + connectionId));
    }

    private DbDialectHandler resolveDialect(ConnectionConfig.Entry entry)
            throws ConnectionSetupException {
        try {
            return dialectFactory.create(entry);
        } catch (IllegalStateException e) {
            throw new ConnectionSetupException(ConnectionSetupException.Kind.CONNECTION_FAILED,
                    e.getMessage(), e);
        }
    }

    private Connection openConnection(ConnectionConfig.Entry entry, DbDialectHandler dialect)
            throws ConnectionSetupException {
        try {
            // Blank driver class relies on JDBC 4 auto-loading
            if (StringUtils.isNotBlank(entry.getDriverClass())) {
                Class.forName(entry.getDriverClass());
            }
        } catch (ClassNotFoundException e) {
            throw new ConnectionSetupException(ConnectionSetupException.Kind.CONNECTION_FAILED,
                    "JDBC driver not found: " + entry.getDriverClass(), e);
        }
        Connection connection;
        try {
            connection =
                    DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
        } catch (SQLException e) {
            throw new ConnectionSetupException(ConnectionSetupException.Kind.CONNECTION_FAILED,
                    "Cannot connect to " + entry.getId() + ": " + e.getMessage(), e);
        }
        try {
            dialect.prepareConnection(connection);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw new ConnectionSetupException(ConnectionSetupException.Kind.CONNECTION_FAILED,
                    "Session setup failed on " + entry.getId() + ": " + e.getMessage(), e);
        }
        log.info("Connected to {} ({})", entry.getId(), dialect.getProduct());
        return connection;
    }

    private static TableIdentifier parseTable(String table) throws SchemaNotFoundException {
        try {
            return TableIdentifier.parse(table);
        } catch (IllegalArgumentException e) {
            throw new SchemaNotFoundException(null,
                    "Invalid table name '" + table + "': " + e.getMessage(), e);
        }
    }

    private static char csvDelimiter(ImportConfig config) {
        String delimiter = config.getCsv().getDelimiter();
        Preconditions.checkArgument(delimiter != null && delimiter.length() == 1,
                "sheetlink.csv.delimiter must be a single character: '%s'", delimiter);
        return delimiter.charAt(0);
    }

    private static void closeCursor(String operationId, SourceCursor cursor) {
        try {
            cursor.close();
        } catch (IOException e) {
            log.warn("[op={}] Failed to close source {}: {}", operationId,
                    cursor.getSourceName(), e.getMessage());
        }
    }

    private static void closeSession(String operationId, JdbcSqlSession session) {
        try {
            session.close();
        } catch (SQLException e) {
            log.warn("[op={}] Failed to close connection: {}", operationId, e.getMessage());
        }
    }
}
