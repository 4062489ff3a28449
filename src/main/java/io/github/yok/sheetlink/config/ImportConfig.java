package io.github.yok.sheetlink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Import settings loaded from the {@code sheetlink} section of {@code application.yml}.
 *
 * <pre>
 * sheetlink:
 *   chunk-size: 500
 *   failure-log: logs/import-failures.log
 *   locale: en-US
 *   progress-queue-capacity: 64
 *   csv:
 *     delimiter: ","
 *     charset: UTF-8
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "sheetlink")
@Data
public class ImportConfig {

    // Rows per transaction
    private int chunkSize = 500;

    // Append-only failure log file
    private String failureLog = "logs/import-failures.log";

    // BCP 47 tag for numeric parsing when a mapping names no locale
    private String locale = "en-US";

    // Progress events buffered for a polling caller before the oldest are dropped
    private int progressQueueCapacity = 64;

    // Delimited text settings
    private Csv csv = new Csv();

    /**
     * Settings for CSV sources.
     */
    @Data
    public static class Csv {
        // Field delimiter (single character)
        private String delimiter = ",";
        // File encoding
        private String charset = "UTF-8";
    }
}
