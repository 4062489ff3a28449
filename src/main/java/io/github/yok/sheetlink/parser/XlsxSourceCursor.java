package io.github.yok.sheetlink.parser;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.ss.usermodel.BuiltinFormats;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.util.XMLHelper;
import org.apache.poi.xssf.eventusermodel.ReadOnlySharedStringsTable;
import org.apache.poi.xssf.eventusermodel.XSSFReader;
import org.apache.poi.xssf.model.SharedStrings;
import org.apache.poi.xssf.model.StylesTable;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.xml.sax.SAXException;

/**
 * Streaming reader for one sheet of an Office Open XML workbook ({@code .xlsx}, {@code .xlsm}).
 *
 * <p>
 * The sheet part is pulled element by element with StAX, so only the shared-strings and styles
 * tables are held in memory. Numeric cells whose style is a date format become
 * {@link LocalDateTime}; other numeric cells become {@link BigDecimal}. Error cells are reported as
 * {@code null}. Dates use the 1900 date system.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class XlsxSourceCursor extends AbstractSourceCursor {

    private final OPCPackage pkg;
    private final InputStream sheetStream;
    private final XMLStreamReader xml;
    private final SharedStrings sharedStrings;
    private final StylesTable styles;

    private long lastRowNumber = -1;
    private long previousRowNumber;

    private XlsxSourceCursor(String sourceName, OPCPackage pkg, InputStream sheetStream,
            XMLStreamReader xml, SharedStrings sharedStrings, StylesTable styles) {
        super(sourceName);
        this.pkg = pkg;
        this.sheetStream = sheetStream;
        this.xml = xml;
        this.sharedStrings = sharedStrings;
        this.styles = styles;
    }

    /**
     * Opens a sheet for streaming.
     *
     * @param file workbook file
     * @param sheetName sheet to read, or {@code null} for the first sheet
     * @return opened cursor positioned before the first data row
     * @throws SourceReadException if the workbook cannot be read, the sheet does not exist, or the
     *         sheet holds no data
     */
    static XlsxSourceCursor open(Path file, String sheetName) throws SourceReadException {
        OPCPackage pkg = openPackage(file);
        InputStream stream = null;
        XlsxSourceCursor cursor = null;
        try {
            XSSFReader reader = new XSSFReader(pkg);
            SharedStrings sst = new ReadOnlySharedStringsTable(pkg);
            StylesTable styles = reader.getStylesTable();
            XSSFReader.SheetIterator sheets = (XSSFReader.SheetIterator) reader.getSheetsData();
            String resolvedName = null;
            while (sheets.hasNext()) {
                InputStream candidate = sheets.next();
                if (sheetName == null || sheets.getSheetName().equals(sheetName)) {
                    stream = candidate;
                    resolvedName = sheets.getSheetName();
                    break;
                }
                candidate.close();
            }
            if (stream == null) {
                if (sheetName == null) {
                    throw new SourceReadException(SourceReadException.Kind.EMPTY_SOURCE,
                            file.getFileName() + " contains no sheets");
                }
                throw new SourceReadException(SourceReadException.Kind.SHEET_NOT_FOUND,
                        "Sheet not found in " + file.getFileName() + ": " + sheetName);
            }
            XMLStreamReader xml = XMLHelper.newXMLInputFactory().createXMLStreamReader(stream);
            cursor = new XlsxSourceCursor(file.getFileName() + "#" + resolvedName, pkg, stream,
                    xml, sst, styles);
            cursor.open();
            return cursor;
        } catch (SourceReadException e) {
            closeOnFailure(cursor, stream, pkg);
            throw e;
        } catch (IOException | OpenXML4JException | SAXException | XMLStreamException
                | POIXMLException e) {
            closeOnFailure(cursor, stream, pkg);
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Failed to read workbook " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lists the sheets of a workbook in workbook order.
     *
     * @param file workbook file
     * @return sheet names
     * @throws SourceReadException if the workbook cannot be read
     */
    static List<String> listSheets(Path file) throws SourceReadException {
        OPCPackage pkg = openPackage(file);
        try {
            XSSFReader reader = new XSSFReader(pkg);
            XSSFReader.SheetIterator sheets = (XSSFReader.SheetIterator) reader.getSheetsData();
            List<String> names = new ArrayList<>();
            while (sheets.hasNext()) {
                try (InputStream ignored = sheets.next()) {
                    names.add(sheets.getSheetName());
                }
            }
            return names;
        } catch (IOException | OpenXML4JException | POIXMLException e) {
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Failed to read workbook " + file.getFileName() + ": " + e.getMessage(), e);
        } finally {
            pkg.revert();
        }
    }

    private static OPCPackage openPackage(Path file) throws SourceReadException {
        try {
            return OPCPackage.open(file.toFile(), PackageAccess.READ);
        } catch (OpenXML4JException | UnsupportedFileFormatException e) {
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Not a readable OOXML workbook: " + file.getFileName(), e);
        }
    }

    private static void closeOnFailure(XlsxSourceCursor cursor, InputStream stream,
            OPCPackage pkg) {
        try {
            if (cursor != null) {
                cursor.close();
                return;
            }
            if (stream != null) {
                stream.close();
            }
        } catch (IOException e) {
            log.warn("Failed to release workbook resources: {}", e.getMessage());
        }
        pkg.revert();
    }

    @Override
    protected RawRow readRawRow() throws IOException {
        try {
            while (xml.hasNext()) {
                int event = xml.next();
                if (event != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                String name = xml.getLocalName();
                if ("dimension".equals(name)) {
                    lastRowNumber = parseDimension(xml.getAttributeValue(null, "ref"));
                } else if ("row".equals(name)) {
                    return readRow();
                }
            }
            return null;
        } catch (XMLStreamException | RuntimeException e) {
            throw new IOException("Malformed sheet data in " + getSourceName(), e);
        }
    }

    @Override
    protected long getLastRowNumber() {
        return lastRowNumber;
    }

    private RawRow readRow() throws XMLStreamException {
        String rowRef = xml.getAttributeValue(null, "r");
        long rowNumber = rowRef != null ? Long.parseLong(rowRef) : previousRowNumber + 1;
        previousRowNumber = rowNumber;

        List<Object> cells = new ArrayList<>();
        int nextColumn = 0;
        while (xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.START_ELEMENT && "c".equals(xml.getLocalName())) {
                String cellRef = xml.getAttributeValue(null, "r");
                int column = cellRef != null ? new CellReference(cellRef).getCol() : nextColumn;
                Object value = readCell(xml.getAttributeValue(null, "t"),
                        xml.getAttributeValue(null, "s"));
                while (cells.size() < column) {
                    cells.add(null);
                }
                if (cells.size() == column) {
                    cells.add(value);
                } else {
                    cells.set(column, value);
                }
                nextColumn = column + 1;
            } else if (event == XMLStreamConstants.END_ELEMENT
                    && "row".equals(xml.getLocalName())) {
                break;
            }
        }
        return new RawRow(rowNumber, cells);
    }

    private Object readCell(String type, String styleIndex) throws XMLStreamException {
        String value = null;
        StringBuilder inline = null;
        while (xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String name = xml.getLocalName();
                if ("v".equals(name)) {
                    value = xml.getElementText();
                } else if ("is".equals(name)) {
                    inline = new StringBuilder();
                } else if ("rPh".equals(name)) {
                    skipElement("rPh");
                } else if ("t".equals(name) && inline != null) {
                    inline.append(xml.getElementText());
                }
            } else if (event == XMLStreamConstants.END_ELEMENT && "c".equals(xml.getLocalName())) {
                break;
            }
        }
        return convert(type, styleIndex, value, inline);
    }

    private void skipElement(String name) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
        log.trace("Skipped <{}>", name);
    }

    private Object convert(String type, String styleIndex, String value, StringBuilder inline) {
        if ("inlineStr".equals(type)) {
            return inline != null ? inline.toString() : value;
        }
        if (value == null) {
            return null;
        }
        if ("s".equals(type)) {
            return sharedStrings.getItemAt(Integer.parseInt(value.trim())).getString();
        }
        if ("str".equals(type)) {
            return value;
        }
        if ("b".equals(type)) {
            return "1".equals(value.trim()) || "true".equalsIgnoreCase(value.trim());
        }
        if ("e".equals(type)) {
            return null;
        }
        if ("d".equals(type)) {
            return parseIsoDate(value);
        }
        BigDecimal number = new BigDecimal(value.trim());
        if (isDateStyle(styleIndex) && DateUtil.isValidExcelDate(number.doubleValue())) {
            return DateUtil.getLocalDateTime(number.doubleValue());
        }
        return number;
    }

    private boolean isDateStyle(String styleIndex) {
        if (styles == null || styleIndex == null) {
            return false;
        }
        XSSFCellStyle style = styles.getStyleAt(Integer.parseInt(styleIndex));
        if (style == null) {
            return false;
        }
        short formatIndex = style.getDataFormat();
        String format = style.getDataFormatString();
        if (format == null) {
            format = BuiltinFormats.getBuiltinFormat(formatIndex);
        }
        return DateUtil.isADateFormat(formatIndex, format);
    }

    private static Object parseIsoDate(String value) {
        try {
            return LocalDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value.trim()).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                return value;
            }
        }
    }

    private static long parseDimension(String ref) {
        if (ref == null || ref.isEmpty()) {
            return -1;
        }
        int colon = ref.indexOf(':');
        String last = colon >= 0 ? ref.substring(colon + 1) : ref;
        return new CellReference(last).getRow() + 1L;
    }

    @Override
    public void close() throws IOException {
        try {
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Failed to close sheet reader of " + getSourceName(), e);
        } finally {
            sheetStream.close();
            pkg.revert();
        }
    }
}
