package io.github.yok.sheetlink.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link SourceReaderFactory}.
 */
class SourceReaderFactoryTest {

    @TempDir
    Path tempDir;

    private final SourceReaderFactory factory = new SourceReaderFactory();

    private Path workbook(Workbook wb, String name) throws Exception {
        Path file = tempDir.resolve(name);
        try (Workbook w = wb; OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = w.createSheet("S1");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("ID");
            sheet.createRow(1).createCell(0).setCellValue(1);
            w.createSheet("S2");
            w.write(out);
        }
        return file;
    }

    @Test
    void detectFormat_正常ケース_拡張子ごと_対応する形式が返ること() throws Exception {
        assertEquals(SourceFormat.XLSX,
                factory.detectFormat(workbook(new XSSFWorkbook(), "a.xlsx")));
        assertEquals(SourceFormat.XLSX,
                factory.detectFormat(workbook(new XSSFWorkbook(), "b.XLSM")));
        assertEquals(SourceFormat.XLS, factory.detectFormat(workbook(new HSSFWorkbook(), "c.xls")));
        Path csv = tempDir.resolve("d.csv");
        Files.write(csv, "ID\n1\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(SourceFormat.CSV, factory.detectFormat(csv));
    }

    @Test
    void detectFormat_正常ケース_拡張子と中身が異なる_中身の形式が優先されること() throws Exception {
        Path file = workbook(new HSSFWorkbook(), "renamed.xlsx");
        assertEquals(SourceFormat.XLS, factory.detectFormat(file));
        try (SourceCursor cursor = factory.open(file, null)) {
            assertEquals(Collections.singletonList("ID"), cursor.getHeader());
        }
    }

    @Test
    void detectFormat_異常ケース_未対応の拡張子_UNSUPPORTED_FORMATが送出されること() throws Exception {
        Path file = tempDir.resolve("data.json");
        Files.write(file, "{}".getBytes(StandardCharsets.UTF_8));
        SourceReadException ex =
                assertThrows(SourceReadException.class, () -> factory.detectFormat(file));
        assertEquals(SourceReadException.Kind.UNSUPPORTED_FORMAT, ex.getKind());
    }

    @Test
    void detectFormat_異常ケース_存在しないファイル_CORRUPT_FILEが送出されること() {
        SourceReadException ex = assertThrows(SourceReadException.class,
                () -> factory.detectFormat(tempDir.resolve("missing.xlsx")));
        assertEquals(SourceReadException.Kind.CORRUPT_FILE, ex.getKind());
    }

    @Test
    void detectFormat_異常ケース_ブックでない中身_CORRUPT_FILEが送出されること() throws Exception {
        Path text = tempDir.resolve("fake.xlsx");
        Files.write(text, "ID,Name\n1,Alice\n".getBytes(StandardCharsets.UTF_8));
        SourceReadException ex =
                assertThrows(SourceReadException.class, () -> factory.detectFormat(text));
        assertEquals(SourceReadException.Kind.CORRUPT_FILE, ex.getKind());

        Path empty = tempDir.resolve("empty.xls");
        Files.write(empty, new byte[0]);
        assertEquals(SourceReadException.Kind.CORRUPT_FILE,
                assertThrows(SourceReadException.class, () -> factory.detectFormat(empty))
                        .getKind());
    }

    @Test
    void open_正常ケース_CSVを開く_区切り文字設定が使われること() throws Exception {
        Path csv = tempDir.resolve("semi.csv");
        Files.write(csv, "ID;Name\n1;Alice\n".getBytes(StandardCharsets.UTF_8));
        try (SourceCursor cursor =
                new SourceReaderFactory(';', StandardCharsets.UTF_8).open(csv, "ignored")) {
            assertEquals(Arrays.asList("ID", "Name"), cursor.getHeader());
            assertEquals("Alice", cursor.nextRow().get("Name"));
        }
    }

    @Test
    void listSheets_正常ケース_形式ごと_シート名が返ること() throws Exception {
        assertEquals(Arrays.asList("S1", "S2"),
                factory.listSheets(workbook(new XSSFWorkbook(), "l.xlsx")));
        assertEquals(Arrays.asList("S1", "S2"),
                factory.listSheets(workbook(new HSSFWorkbook(), "l.xls")));
        Path csv = tempDir.resolve("customers.csv");
        Files.write(csv, "ID\n1\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(Collections.singletonList("customers"), factory.listSheets(csv));
    }

    @Test
    void open_異常ケース_シートが空_例外の種別が保持されること() throws Exception {
        Path file = workbook(new XSSFWorkbook(), "e.xlsx");
        SourceReadException ex =
                assertThrows(SourceReadException.class, () -> factory.open(file, "S2"));
        assertTrue(ex.getKind() == SourceReadException.Kind.EMPTY_SOURCE);
    }
}
