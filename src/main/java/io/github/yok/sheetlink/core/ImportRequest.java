package io.github.yok.sheetlink.core;

import io.github.yok.sheetlink.mapping.FieldMapping;
import io.github.yok.sheetlink.mapping.ImportMode;
import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Parameters of one import run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ImportRequest {

    // Run ID for logs; generated when null
    String operationId;

    // Connection profile ID from application.yml
    String connectionId;

    // Source file (.xlsx, .xlsm, .xls, .csv)
    Path file;

    // Sheet to read; null for the first sheet
    String sheetName;

    // Target table, optionally qualified (schema.table, catalog.schema.table)
    String table;

    ImportMode mode;

    @Singular
    List<FieldMapping> mappings;

    // Rows per transaction; null for the configured default
    Integer chunkSize;
}
