package io.github.yok.sheetlink.mapping;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sheetlink.schema.ColumnDescriptor;
import io.github.yok.sheetlink.schema.DataKind;
import java.math.BigDecimal;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ValueCoercer}.
 */
class ValueCoercerTest {

    private static ColumnDescriptor column(DataKind kind, int jdbcType, int size) {
        return ColumnDescriptor.builder().name("COL").ordinal(1).kind(kind).jdbcType(jdbcType)
                .typeName(String.valueOf(jdbcType)).size(size).nullable(true).build();
    }

    private static ValueCoercer coercer(DataKind kind, int jdbcType) {
        return ValueCoercer.create(column(kind, jdbcType, 0), CoercionRule.DEFAULT, Locale.US);
    }

    private static ValueCoercer coercer(DataKind kind, int jdbcType, CoercionRule rule) {
        return ValueCoercer.create(column(kind, jdbcType, 0), rule, Locale.US);
    }

    @Test
    void coerce_正常ケース_空白文字列を指定する_nullが返ること() throws Exception {
        assertNull(coercer(DataKind.TEXT, Types.VARCHAR).coerce("   "));
        assertNull(coercer(DataKind.INTEGER, Types.INTEGER).coerce(null));
    }

    @Test
    void coerce_正常ケース_trimとblankAsNullを無効にする_空白が保持されること() throws Exception {
        CoercionRule rule = CoercionRule.builder().trim(false).blankAsNull(false).build();
        assertEquals("  ", coercer(DataKind.TEXT, Types.VARCHAR, rule).coerce("  "));
        assertEquals(" a ", coercer(DataKind.TEXT, Types.VARCHAR, rule).coerce(" a "));
    }

    @Test
    void coerce_正常ケース_数値を文字列列へ指定する_末尾ゼロなしの文字列が返ること() throws Exception {
        assertEquals("42", coercer(DataKind.TEXT, Types.VARCHAR).coerce(new BigDecimal("42.0")));
        assertEquals("2024-02-13", coercer(DataKind.TEXT, Types.VARCHAR)
                .coerce(LocalDateTime.of(2024, 2, 13, 0, 0)));
    }

    @Test
    void coerce_異常ケース_列長を超える文字列を指定する_CoercionExceptionが送出されること() {
        ValueCoercer coercer = ValueCoercer.create(column(DataKind.TEXT, Types.VARCHAR, 5),
                CoercionRule.DEFAULT, Locale.US);
        CoercionException ex =
                assertThrows(CoercionException.class, () -> coercer.coerce("abcdef"));
        assertTrue(ex.getMessage().contains("exceeds column size 5"));
    }

    @Test
    void coerce_正常ケース_整数列へ数値文字列を指定する_Integerが返ること() throws Exception {
        assertEquals(42, coercer(DataKind.INTEGER, Types.INTEGER).coerce("42"));
        assertEquals(7, coercer(DataKind.INTEGER, Types.INTEGER).coerce(new BigDecimal("7.0")));
    }

    @Test
    void coerce_正常ケース_BIGINT列を指定する_Longが返ること() throws Exception {
        assertEquals(5_000_000_000L, coercer(DataKind.INTEGER, Types.BIGINT).coerce("5000000000"));
    }

    @Test
    void coerce_異常ケース_整数列へ小数を指定する_CoercionExceptionが送出されること() {
        ValueCoercer coercer = coercer(DataKind.INTEGER, Types.INTEGER);
        assertThrows(CoercionException.class, () -> coercer.coerce("4.5"));
        assertThrows(CoercionException.class, () -> coercer.coerce("5000000000"));
        assertThrows(CoercionException.class, () -> coercer.coerce("abc"));
    }

    @Test
    void coerce_異常ケース_SMALLINTの範囲外を指定する_CoercionExceptionが送出されること() {
        ValueCoercer coercer = coercer(DataKind.INTEGER, Types.SMALLINT);
        assertThrows(CoercionException.class, () -> coercer.coerce("40000"));
    }

    @Test
    void coerce_正常ケース_桁区切り付き金額を指定する_BigDecimalが返ること() throws Exception {
        Object value = coercer(DataKind.DECIMAL, Types.DECIMAL).coerce("1,234.50");
        assertEquals(0, new BigDecimal("1234.50").compareTo((BigDecimal) value));
    }

    @Test
    void coerce_正常ケース_ドイツ語ロケールを指定する_カンマが小数点として解釈されること() throws Exception {
        CoercionRule rule = CoercionRule.builder().locale("de-DE").build();
        Object value = coercer(DataKind.DECIMAL, Types.DECIMAL, rule).coerce("1.234,5");
        assertEquals(0, new BigDecimal("1234.5").compareTo((BigDecimal) value));
    }

    @Test
    void coerce_正常ケース_指数表記を指定する_BigDecimalが返ること() throws Exception {
        Object value = coercer(DataKind.DECIMAL, Types.DOUBLE).coerce("1.5E3");
        assertEquals(0, new BigDecimal("1500").compareTo((BigDecimal) value));
    }

    @Test
    void coerce_正常ケース_日付パターンDDMMYYYYを指定する_LocalDateが返ること() throws Exception {
        CoercionRule rule = CoercionRule.builder().datePattern("DD/MM/YYYY").build();
        assertEquals(LocalDate.of(2024, 2, 13),
                coercer(DataKind.DATE, Types.DATE, rule).coerce("13/02/2024"));
    }

    @Test
    void coerce_異常ケース_存在しない日付を指定する_CoercionExceptionが送出されること() {
        CoercionRule rule = CoercionRule.builder().datePattern("DD/MM/YYYY").build();
        ValueCoercer coercer = coercer(DataKind.DATE, Types.DATE, rule);
        assertThrows(CoercionException.class, () -> coercer.coerce("31/02/2024"));
        assertThrows(CoercionException.class, () -> coercer.coerce("2024-02-13"));
    }

    @Test
    void coerce_正常ケース_パターンなしでISO日付を指定する_LocalDateが返ること() throws Exception {
        ValueCoercer coercer = coercer(DataKind.DATE, Types.DATE);
        assertEquals(LocalDate.of(2024, 2, 13), coercer.coerce("2024-02-13"));
        assertEquals(LocalDate.of(2024, 2, 13), coercer.coerce("2024/02/13"));
        assertEquals(LocalDate.of(2024, 2, 13), coercer.coerce("20240213"));
    }

    @Test
    void coerce_正常ケース_シリアル値を指定する_日付に変換されること() throws Exception {
        assertEquals(LocalDate.of(2024, 2, 13),
                coercer(DataKind.DATE, Types.DATE).coerce(new BigDecimal("45335")));
    }

    @Test
    void coerce_異常ケース_時刻付きの値を日付列へ指定する_CoercionExceptionが送出されること() {
        ValueCoercer coercer = coercer(DataKind.DATE, Types.DATE);
        assertThrows(CoercionException.class,
                () -> coercer.coerce(LocalDateTime.of(2024, 2, 13, 10, 30)));
    }

    @Test
    void coerce_正常ケース_日時文字列を指定する_LocalDateTimeが返ること() throws Exception {
        ValueCoercer coercer = coercer(DataKind.DATETIME, Types.TIMESTAMP);
        assertEquals(LocalDateTime.of(2024, 2, 13, 10, 30),
                coercer.coerce("2024-02-13 10:30"));
        assertEquals(LocalDateTime.of(2024, 2, 13, 10, 30, 15),
                coercer.coerce("2024-02-13T10:30:15"));
        assertEquals(LocalDateTime.of(2024, 2, 13, 0, 0), coercer.coerce("2024-02-13"));
    }

    @Test
    void coerce_正常ケース_時刻文字列を指定する_LocalTimeが返ること() throws Exception {
        ValueCoercer coercer = coercer(DataKind.TIME, Types.TIME);
        assertEquals(LocalTime.of(13, 45), coercer.coerce("13:45"));
        assertEquals(LocalTime.of(13, 45, 10), coercer.coerce("134510"));
        assertThrows(CoercionException.class, () -> coercer.coerce("noon"));
    }

    @Test
    void coerce_正常ケース_真偽値の表記を指定する_Booleanが返ること() throws Exception {
        ValueCoercer coercer = coercer(DataKind.BOOLEAN, Types.BOOLEAN);
        assertEquals(Boolean.TRUE, coercer.coerce("Yes"));
        assertEquals(Boolean.TRUE, coercer.coerce("1"));
        assertEquals(Boolean.FALSE, coercer.coerce("n"));
        assertEquals(Boolean.FALSE, coercer.coerce(BigDecimal.ZERO));
        assertEquals(Boolean.TRUE, coercer.coerce(Boolean.TRUE));
        assertThrows(CoercionException.class, () -> coercer.coerce("maybe"));
        assertThrows(CoercionException.class, () -> coercer.coerce(new BigDecimal("2")));
    }

    @Test
    void coerce_正常ケース_16進文字列を指定する_バイト配列が返ること() throws Exception {
        ValueCoercer coercer = coercer(DataKind.BINARY, Types.VARBINARY);
        assertArrayEquals(new byte[] {10, 11}, (byte[]) coercer.coerce("0x0A0B"));
        assertArrayEquals(new byte[] {10, 11}, (byte[]) coercer.coerce("0a0b"));
        assertThrows(CoercionException.class, () -> coercer.coerce("xyz"));
    }

    @Test
    void coerce_正常ケース_Base64を指定する_バイト配列が返ること() throws Exception {
        CoercionRule rule =
                CoercionRule.builder().binaryEncoding(CoercionRule.BinaryEncoding.BASE64).build();
        assertArrayEquals(new byte[] {1, 2},
                (byte[]) coercer(DataKind.BINARY, Types.BLOB, rule).coerce("AQI="));
    }

    @Test
    void coerce_正常ケース_OTHER列を指定する_値がそのまま返ること() throws Exception {
        assertEquals("{\"a\":1}", coercer(DataKind.OTHER, Types.OTHER).coerce("{\"a\":1}"));
    }

    @Test
    void create_異常ケース_不正なロケールを指定する_IllegalArgumentExceptionが送出されること() {
        CoercionRule rule = CoercionRule.builder().locale("!!").build();
        assertThrows(IllegalArgumentException.class,
                () -> coercer(DataKind.DECIMAL, Types.DECIMAL, rule));
    }

    @Test
    void create_異常ケース_小数点と桁区切りが同じ_IllegalArgumentExceptionが送出されること() {
        CoercionRule rule =
                CoercionRule.builder().decimalSeparator(',').groupingSeparator(',').build();
        assertThrows(IllegalArgumentException.class,
                () -> coercer(DataKind.DECIMAL, Types.DECIMAL, rule));
    }

    @Test
    void create_異常ケース_予約文字を含む日付パターンを指定する_IllegalArgumentExceptionが送出されること() {
        CoercionRule rule = CoercionRule.builder().datePattern("YYYY-{MM}").build();
        assertThrows(IllegalArgumentException.class,
                () -> coercer(DataKind.DATE, Types.DATE, rule));
    }

    @Test
    void normalizeDatePattern_正常ケース_表計算形式を指定する_DateTimeFormatter形式へ変換されること() {
        assertEquals("dd/MM/uuuu", ValueCoercer.normalizeDatePattern("DD/MM/YYYY"));
        assertEquals("uuuu-MM-dd HH:mm", ValueCoercer.normalizeDatePattern("yyyy-MM-dd HH:mm"));
        assertEquals("'Day' dd", ValueCoercer.normalizeDatePattern("'Day' DD"));
    }
}
