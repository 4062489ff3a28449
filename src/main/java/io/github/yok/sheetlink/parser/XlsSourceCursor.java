package io.github.yok.sheetlink.parser;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.util.RecordFormatException;

/**
 * Reader for one sheet of a legacy binary workbook ({@code .xls}).
 *
 * <p>
 * The BIFF8 format has no row-level pull API in the user model, so the workbook is loaded into
 * memory once; rows are still handed out one at a time. Formula cells report their cached result.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class XlsSourceCursor extends AbstractSourceCursor {

    private final HSSFWorkbook workbook;
    private final Sheet sheet;
    private int nextRowIndex;

    private XlsSourceCursor(String sourceName, HSSFWorkbook workbook, Sheet sheet) {
        super(sourceName);
        this.workbook = workbook;
        this.sheet = sheet;
        this.nextRowIndex = Math.max(0, sheet.getFirstRowNum());
    }

    /**
     * Opens a sheet.
     *
     * @param file workbook file
     * @param sheetName sheet to read, or {@code null} for the first sheet
     * @return opened cursor positioned before the first data row
     * @throws SourceReadException if the workbook cannot be read, the sheet does not exist, or the
     *         sheet holds no data
     */
    static XlsSourceCursor open(Path file, String sheetName) throws SourceReadException {
        HSSFWorkbook workbook = load(file);
        try {
            Sheet sheet;
            if (sheetName == null) {
                if (workbook.getNumberOfSheets() == 0) {
                    throw new SourceReadException(SourceReadException.Kind.EMPTY_SOURCE,
                            file.getFileName() + " contains no sheets");
                }
                sheet = workbook.getSheetAt(0);
            } else {
                sheet = workbook.getSheet(sheetName);
                if (sheet == null) {
                    throw new SourceReadException(SourceReadException.Kind.SHEET_NOT_FOUND,
                            "Sheet not found in " + file.getFileName() + ": " + sheetName);
                }
            }
            XlsSourceCursor cursor =
                    new XlsSourceCursor(file.getFileName() + "#" + sheet.getSheetName(), workbook,
                            sheet);
            cursor.open();
            return cursor;
        } catch (SourceReadException e) {
            closeQuietly(workbook, e);
            throw e;
        } catch (IOException e) {
            closeQuietly(workbook, e);
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
        HSSFWorkbook workbook = load(file);
        List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        try {
            workbook.close();
        } catch (IOException e) {
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Failed to close workbook " + file.getFileName(), e);
        }
        return names;
    }

    private static HSSFWorkbook load(Path file) throws SourceReadException {
        POIFSFileSystem fs = null;
        try {
            fs = new POIFSFileSystem(file.toFile(), true);
            return new HSSFWorkbook(fs);
        } catch (IOException | UnsupportedFileFormatException | EncryptedDocumentException
                | RecordFormatException e) {
            if (fs != null) {
                try {
                    fs.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new SourceReadException(SourceReadException.Kind.CORRUPT_FILE,
                    "Not a readable XLS workbook: " + file.getFileName() + " (" + e.getMessage()
                            + ")",
                    e);
        }
    }

    private static void closeQuietly(HSSFWorkbook workbook, Exception primary) {
        try {
            workbook.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    @Override
    protected RawRow readRawRow() {
        while (nextRowIndex <= sheet.getLastRowNum()) {
            Row row = sheet.getRow(nextRowIndex++);
            if (row == null) {
                continue;
            }
            List<Object> cells = new ArrayList<>();
            for (int c = 0; c < row.getLastCellNum(); c++) {
                cells.add(cellValue(row.getCell(c)));
            }
            return new RawRow(row.getRowNum() + 1L, cells);
        }
        return null;
    }

    @Override
    protected long getLastRowNumber() {
        return sheet.getLastRowNum() + 1L;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getRichStringCellValue().getString();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue());
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
