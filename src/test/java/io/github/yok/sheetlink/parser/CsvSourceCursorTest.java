package io.github.yok.sheetlink.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link CsvSourceCursor}.
 */
class CsvSourceCursorTest {

    @TempDir
    Path tempDir;

    private Path write(String name, byte[] content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    @Test
    void open_正常ケース_BOM付きUTF8を指定する_見出しからBOMが除去されること() throws Exception {
        byte[] body = "ID,Name\n1,Alice\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[body.length + 3];
        content[0] = (byte) 0xEF;
        content[1] = (byte) 0xBB;
        content[2] = (byte) 0xBF;
        System.arraycopy(body, 0, content, 3, body.length);
        Path file = write("bom.csv", content);

        try (CsvSourceCursor cursor = CsvSourceCursor.open(file, ',', StandardCharsets.UTF_8)) {
            assertEquals(Arrays.asList("ID", "Name"), cursor.getHeader());
            assertEquals("1", cursor.nextRow().get("ID"));
        }
    }

    @Test
    void open_正常ケース_空行と引用符を含む_空行が除外され行番号が保持されること() throws Exception {
        Path file = write("data.csv", ("ID,Name,Note\n"
                + "1,\"Smith, John\",\n"
                + "\n"
                + "2,\"multi\nline\",x\n"
                + "3\n").getBytes(StandardCharsets.UTF_8));

        try (CsvSourceCursor cursor = CsvSourceCursor.open(file, ',', StandardCharsets.UTF_8)) {
            assertEquals(-1, cursor.getEstimatedRowCount());
            assertEquals("data.csv", cursor.getSourceName());

            SourceRow first = cursor.nextRow();
            assertEquals(2, first.getRowNumber());
            assertEquals("Smith, John", first.get("Name"));
            assertNull(first.get("Note"));

            SourceRow second = cursor.nextRow();
            assertEquals(4, second.getRowNumber());
            assertEquals("multi\nline", second.get("Name"));

            SourceRow third = cursor.nextRow();
            assertEquals(5, third.getRowNumber());
            assertEquals("3", third.get("ID"));
            assertNull(third.get("Name"));

            assertNull(cursor.nextRow());
        }
    }

    @Test
    void open_異常ケース_見出しに不正なUTF8バイトを含む_CORRUPT_FILEとなること() throws Exception {
        byte[] content = {'I', 'D', (byte) 0xFF, ',', 'N', '\n', '1', ',', 'a', '\n'};
        Path file = write("broken.csv", content);

        SourceReadException ex = assertThrows(SourceReadException.class,
                () -> CsvSourceCursor.open(file, ',', StandardCharsets.UTF_8));

        assertEquals(SourceReadException.Kind.CORRUPT_FILE, ex.getKind());
    }

    @Test
    void nextRow_異常ケース_途中の行に不正なUTF8バイトを含む_IOExceptionが送出されること() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write("ID,Name\n".getBytes(StandardCharsets.UTF_8));
        for (int i = 1; i <= 3000; i++) {
            out.write((i + ",Customer " + i + "\n").getBytes(StandardCharsets.UTF_8));
        }
        out.write(new byte[] {'9', ',', (byte) 0xC3, (byte) 0x28, '\n'});
        Path file = write("late.csv", out.toByteArray());

        try (CsvSourceCursor cursor = CsvSourceCursor.open(file, ',', StandardCharsets.UTF_8)) {
            assertEquals("1", cursor.nextRow().get("ID"));
            assertThrows(IOException.class, () -> {
                while (cursor.nextRow() != null) {
                    // drain until the broken row
                }
            });
        }
    }

    @Test
    void open_正常ケース_セミコロン区切りとShiftJISを指定する_値が読み取れること() throws Exception {
        Charset sjis = Charset.forName("Shift_JIS");
        Path file = write("sjis.csv", "番号;氏名\n1;山田\n".getBytes(sjis));

        try (CsvSourceCursor cursor = CsvSourceCursor.open(file, ';', sjis)) {
            assertEquals(Arrays.asList("番号", "氏名"), cursor.getHeader());
            assertEquals("山田", cursor.nextRow().get("氏名"));
        }
    }

    @Test
    void open_異常ケース_見出しのみ_EMPTY_SOURCEが送出されること() throws Exception {
        Path file = write("header.csv", "ID,Name\n\n".getBytes(StandardCharsets.UTF_8));
        SourceReadException ex = assertThrows(SourceReadException.class,
                () -> CsvSourceCursor.open(file, ',', StandardCharsets.UTF_8));
        assertEquals(SourceReadException.Kind.EMPTY_SOURCE, ex.getKind());
    }

    @Test
    void open_異常ケース_空ファイル_EMPTY_SOURCEが送出されること() throws Exception {
        Path file = write("empty.csv", new byte[0]);
        SourceReadException ex = assertThrows(SourceReadException.class,
                () -> CsvSourceCursor.open(file, ',', StandardCharsets.UTF_8));
        assertEquals(SourceReadException.Kind.EMPTY_SOURCE, ex.getKind());
    }
}
