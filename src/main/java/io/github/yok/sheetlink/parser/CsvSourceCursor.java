package io.github.yok.sheetlink.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Reader for delimited text files.
 *
 * <p>
 * All values are strings. A leading byte-order mark is removed. Empty lines are kept as records so
 * that row numbers match physical line numbers for single-line records; the base class skips them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class CsvSourceCursor extends AbstractSourceCursor {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;

    private CsvSourceCursor(String sourceName, CSVParser parser) {
        super(sourceName);
        this.parser = parser;
        this.records = parser.iterator();
    }

    /**
     * Opens a delimited text file.
     *
     * @param file file to read
     * @param delimiter field delimiter
     * @param charset file encoding
     * @return opened cursor positioned before the first data row
     * @throws SourceReadException if the file cannot be read or holds no data
     */
    static CsvSourceCursor open(Path file, char delimiter, Charset charset)
            throws SourceReadException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setIgnoreEmptyLines(false).build();
        CsvSourceCursor cursor = null;
        try {
            InputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(file))
                    .get();
            // Malformed bytes fail the read instead of turning into replacement characters
            CSVParser parser = format.parse(new InputStreamReader(in,
                    charset.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                            .onUnmappableCharacter(CodingErrorAction.REPORT)));
            cursor = new CsvSourceCursor(file.getFileName().toString(), parser);
            cursor.open();
            return cursor;
        } catch (SourceReadException e) {
            closeQuietly(cursor, e);
            throw e;
        } catch (IOException e) {
            closeQuietly(cursor, e);
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Failed to read " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(CsvSourceCursor cursor, Exception primary) {
        if (cursor == null) {
            return;
        }
        try {
            cursor.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    @Override
    protected RawRow readRawRow() throws IOException {
        try {
            if (!records.hasNext()) {
                return null;
            }
            CSVRecord record = records.next();
            List<Object> cells = new ArrayList<>(record.size());
            for (String value : record) {
                cells.add(value);
            }
            return new RawRow(record.getRecordNumber(), cells);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (IllegalStateException e) {
            throw new IOException("Malformed CSV in " + getSourceName(), e);
        }
    }

    @Override
    protected long getLastRowNumber() {
        return -1;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
