package io.github.yok.sheetlink.parser;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.poi.EmptyFileException;
import org.apache.poi.poifs.filesystem.FileMagic;

/**
 * Factory that opens a {@link SourceCursor} for a spreadsheet or delimited text file.
 *
 * <p>
 * The container is chosen from the file extension (see {@link SourceFormat}) and, for workbooks,
 * confirmed from the file signature:
 * </p>
 * <ul>
 * <li>An OOXML signature is read as {@link SourceFormat#XLSX} and an OLE2 signature as
 * {@link SourceFormat#XLS}, whichever workbook extension the file carries.</li>
 * <li>Any other signature under a workbook extension is reported as
 * {@link SourceReadException.Kind#CORRUPT_FILE}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SourceReaderFactory {

    // Delimiter for CSV sources
    private final char csvDelimiter;

    // Encoding for CSV sources
    private final Charset csvCharset;

    /**
     * Creates a factory with comma-delimited UTF-8 CSV handling.
     */
    public SourceReaderFactory() {
        this(',', StandardCharsets.UTF_8);
    }

    /**
     * Creates a factory.
     *
     * @param csvDelimiter field delimiter for CSV sources
     * @param csvCharset encoding for CSV sources
     */
    public SourceReaderFactory(char csvDelimiter, Charset csvCharset) {
        this.csvDelimiter = csvDelimiter;
        this.csvCharset = csvCharset;
    }

    /**
     * Opens a row stream over one sheet of a file.
     *
     * @param file source file
     * @param sheetName sheet to read, or {@code null} for the first sheet (ignored for CSV)
     * @return cursor positioned before the first data row; the caller closes it
     * @throws SourceReadException if the file cannot be opened as a non-empty row stream
     */
    public SourceCursor open(Path file, String sheetName) throws SourceReadException {
        SourceFormat format = detectFormat(file);
        log.info("Opening source: file={}, format={}, sheet={}", file, format,
                sheetName == null ? "(first)" : sheetName);
        if (format == SourceFormat.XLSX) {
            return XlsxSourceCursor.open(file, sheetName);
        }
        if (format == SourceFormat.XLS) {
            return XlsSourceCursor.open(file, sheetName);
        }
        return CsvSourceCursor.open(file, csvDelimiter, csvCharset);
    }

    /**
     * Lists the sheets of a file in workbook order.
     *
     * <p>
     * A CSV file reports a single sheet named after the file.
     * </p>
     *
     * @param file source file
     * @return sheet names
     * @throws SourceReadException if the file cannot be read
     */
    public List<String> listSheets(Path file) throws SourceReadException {
        SourceFormat format = detectFormat(file);
        if (format == SourceFormat.XLSX) {
            return XlsxSourceCursor.listSheets(file);
        }
        if (format == SourceFormat.XLS) {
            return XlsSourceCursor.listSheets(file);
        }
        return Collections.singletonList(FilenameUtils.getBaseName(file.getFileName().toString()));
    }

    /**
     * Determines the container of a file.
     *
     * @param file source file
     * @return detected format
     * @throws SourceReadException if the file is missing, unreadable, or not a supported format
     */
    SourceFormat detectFormat(Path file) throws SourceReadException {
        String ext = FilenameUtils.getExtension(file.getFileName().toString());
        SourceFormat byExtension = SourceFormat.fromExtension(ext)
                .orElseThrow(() -> new SourceReadException(
                        SourceReadException.Kind.UNSUPPORTED_FORMAT,
                        "Unsupported file type: " + file.getFileName()
                                + " (expected .xlsx, .xlsm, .xls or .csv)"));
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "File not found or not readable: " + file);
        }
        if (byExtension == SourceFormat.CSV) {
            return byExtension;
        }
        FileMagic magic;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            magic = FileMagic.valueOf(in);
        } catch (IOException | EmptyFileException e) {
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Failed to read file signature: " + file.getFileName(), e);
        }
        SourceFormat byContent;
        if (magic == FileMagic.OOXML) {
            byContent = SourceFormat.XLSX;
        } else if (magic == FileMagic.OLE2) {
            byContent = SourceFormat.XLS;
        } else {
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "File content is not a workbook: " + file.getFileName() + " (" + magic + ")");
        }
        if (byContent != byExtension) {
            log.warn("File extension does not match its content: file={}, content={}",
                    file.getFileName(), byContent);
        }
        return byContent;
    }
}
