package io.github.yok.sheetlink;

import io.github.yok.sheetlink.config.ConnectionConfig;
import io.github.yok.sheetlink.config.ImportConfig;
import io.github.yok.sheetlink.core.BatchOutcome;
import io.github.yok.sheetlink.core.BatchResult;
import io.github.yok.sheetlink.core.ImportRequest;
import io.github.yok.sheetlink.core.ImportService;
import io.github.yok.sheetlink.mapping.FieldMapping;
import io.github.yok.sheetlink.mapping.ImportMode;
import io.github.yok.sheetlink.mapping.MappingDefinitionLoader;
import io.github.yok.sheetlink.progress.CancellationToken;
import io.github.yok.sheetlink.progress.LoggingProgressSink;
import io.github.yok.sheetlink.progress.ProgressChannel;
import io.github.yok.sheetlink.progress.ProgressEvent;
import io.github.yok.sheetlink.util.ErrorHandler;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --file <path>} or {@code -f <path>}: source file (.xlsx, .xlsm, .xls, .csv).</li>
 * <li>{@code --sheet <name>} or {@code -s <name>}: sheet to read; the first sheet if omitted.</li>
 * <li>{@code --table <name>} or {@code -t <name>}: target table, optionally
 * {@code schema.table}.</li>
 * <li>{@code --mode insert|update} or {@code -m ...}: write mode, {@code insert} if omitted.</li>
 * <li>{@code --mapping <json>} or {@code -p <json>}: mapping definition file.</li>
 * <li>{@code --map Source=Target}: inline field mapping, repeatable.</li>
 * <li>{@code --key <column>}: flags the mapping of this target column as the update key.</li>
 * <li>{@code --db <id>} or {@code -d <id>}: connection ID from {@code application.yml}; may be
 * omitted when only one connection is configured.</li>
 * <li>{@code --chunk-size <n>} or {@code -c <n>}: rows per transaction.</li>
 * <li>{@code --list-sheets}: prints the sheet names of {@code --file} and exits.</li>
 * </ul>
 *
 * <p>
 * The import runs on a worker thread. Progress is polled from a {@link ProgressChannel} and logged.
 * A JVM shutdown hook (Ctrl+C) requests cancellation and waits until the chunk in flight has
 * settled, so the table never holds a half-written chunk.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, ImportConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    // Progress poll interval of the main thread
    private static final long POLL_INTERVAL_MILLIS = 500;

    private final ImportConfig importConfig;
    private final ImportService importService;
    private final MappingDefinitionLoader mappingLoader = new MappingDefinitionLoader();

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String file = null;
        String sheet = null;
        String table = null;
        String mode = "insert";
        String mappingFile = null;
        List<String> inlineMappings = new ArrayList<>();
        String keyColumn = null;
        String connectionId = null;
        String chunkSize = null;
        boolean listSheets = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--file":
                case "-f":
                    file = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--sheet":
                case "-s":
                    sheet = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--table":
                case "-t":
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--mode":
                case "-m":
                    mode = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--mapping":
                case "-p":
                    mappingFile = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--map":
                    if (i + 1 < args.length) {
                        inlineMappings.add(args[++i]);
                    }
                    break;
                case "--key":
                    keyColumn = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--db":
                case "-d":
                    connectionId = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--chunk-size":
                case "-c":
                    chunkSize = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--list-sheets":
                    listSheets = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (file == null || file.isEmpty()) {
            ErrorHandler.errorAndExit("Source file is required (--file).");
            return;
        }
        Path source = Paths.get(file);

        if (listSheets) {
            try {
                List<String> sheets = importService.listSheets(source);
                log.info("Sheets of {}: {}", source, sheets);
                sheets.forEach(System.out::println);
            } catch (ImportSetupException e) {
                ErrorHandler.errorAndExit("Cannot list sheets of " + source, e);
            }
            return;
        }

        if (table == null || table.isEmpty()) {
            ErrorHandler.errorAndExit("Target table is required (--table).");
            return;
        }

        ImportMode importMode;
        try {
            importMode = ImportMode.valueOf(String.valueOf(mode).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Unknown mode: " + mode + " (insert or update)");
            return;
        }

        Integer chunk = null;
        if (chunkSize != null) {
            try {
                chunk = Integer.valueOf(chunkSize.trim());
            } catch (NumberFormatException e) {
                ErrorHandler.errorAndExit("Invalid chunk size: " + chunkSize);
                return;
            }
        }

        List<FieldMapping> mappings = new ArrayList<>();
        try {
            if (mappingFile != null) {
                mappings.addAll(mappingLoader.load(Paths.get(mappingFile)));
            }
            mappings.addAll(mappingLoader.parseInline(inlineMappings));
        } catch (IOException | IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid mapping definition: " + e.getMessage(), e);
            return;
        }
        if (mappings.isEmpty()) {
            ErrorHandler.errorAndExit("No mappings given (--mapping or --map).");
            return;
        }
        if (keyColumn != null) {
            mappings = mappingLoader.withKey(mappings, keyColumn);
        }

        ImportRequest request = ImportRequest.builder().connectionId(connectionId).file(source)
                .sheetName(sheet).table(table).mode(importMode).mappings(mappings)
                .chunkSize(chunk).build();

        log.info("Mode: {}, File: {}, Sheet: {}, Table: {}, DB: {}", importMode, source, sheet,
                table, connectionId);
        execute(request);
    }

    /**
     * Runs the import on a worker thread and relays its progress to the log.
     *
     * @param request import request
     */
    void execute(ImportRequest request) {
        ProgressChannel channel = new ProgressChannel(importConfig.getProgressQueueCapacity());
        CancellationToken token = new CancellationToken();
        LoggingProgressSink reporter = new LoggingProgressSink();
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sheetlink-import");
            t.setDaemon(true);
            return t;
        });
        Future<BatchResult> future =
                worker.submit(() -> importService.execute(request, channel, token));

        Thread shutdownHook = new Thread(() -> {
            log.warn("Shutdown requested; cancelling after the current chunk");
            token.cancel();
            try {
                future.get();
            } catch (ExecutionException e) {
                log.warn("Import ended with an error during shutdown: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the import to settle");
            }
        }, "sheetlink-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            while (!future.isDone()) {
                ProgressEvent event = channel.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    reporter.onProgress(event);
                }
            }
            channel.drain().forEach(reporter::onProgress);
            if (channel.getDroppedCount() > 0) {
                log.debug("{} progress events were superseded", channel.getDroppedCount());
            }

            BatchResult result = future.get();
            reporter.onFinished(result);
            if (result.getOutcome() == BatchOutcome.ABORTED) {
                ErrorHandler.errorAndExit("Import aborted: " + result.getFatalError());
            } else if (result.getFailed() > 0) {
                log.warn("{} rows were not written; see {}", result.getFailed(),
                        importConfig.getFailureLog());
            }
        } catch (ExecutionException e) {
            ErrorHandler.errorAndExit("Import failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            ErrorHandler.errorAndExit("Interrupted while waiting for the import", e);
        } finally {
            worker.shutdown();
            removeShutdownHook(shutdownHook);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running
            log.debug("Shutdown hook not removed: {}", e.getMessage());
        }
    }
}
