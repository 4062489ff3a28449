package io.github.yok.sheetlink.mapping;

import com.google.common.io.BaseEncoding;
import io.github.yok.sheetlink.schema.ColumnDescriptor;
import java.math.BigDecimal;
import java.sql.Types;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQuery;
import java.util.Locale;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.DateUtil;

/**
 * Converts raw source values to the Java type bound for one target column.
 *
 * <p>
 * The conversion is chosen by the column's {@link io.github.yok.sheetlink.schema.DataKind} and
 * tuned by a {@link CoercionRule}. Results are {@link String}, {@link Integer}, {@link Long},
 * {@link BigDecimal}, {@link LocalDate}, {@link LocalDateTime}, {@link LocalTime},
 * {@link Boolean} or {@code byte[]}. Instances are immutable and hold no per-row state.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class ValueCoercer {

    private final ColumnDescriptor column;
    private final CoercionRule rule;
    private final DateTimeFormatter datePattern;
    private final DecimalFormatSymbols symbols;

    private ValueCoercer(ColumnDescriptor column, CoercionRule rule, DateTimeFormatter datePattern,
            DecimalFormatSymbols symbols) {
        this.column = column;
        this.rule = rule;
        this.datePattern = datePattern;
        this.symbols = symbols;
    }

    /**
     * Creates a coercer for a column.
     *
     * @param column target column
     * @param rule coercion rule
     * @param defaultLocale locale used when the rule names none
     * @return coercer
     * @throws IllegalArgumentException if the rule's pattern, locale or separators are invalid
     */
    static ValueCoercer create(ColumnDescriptor column, CoercionRule rule, Locale defaultLocale) {
        Locale locale = defaultLocale;
        if (StringUtils.isNotBlank(rule.getLocale())) {
            locale = Locale.forLanguageTag(rule.getLocale().trim().replace('_', '-'));
            if (locale.getLanguage().isEmpty()) {
                throw new IllegalArgumentException("Unknown locale: " + rule.getLocale());
            }
        }
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(locale);
        if (rule.getDecimalSeparator() != null) {
            symbols.setDecimalSeparator(rule.getDecimalSeparator());
            symbols.setMonetaryDecimalSeparator(rule.getDecimalSeparator());
        }
        if (rule.getGroupingSeparator() != null) {
            symbols.setGroupingSeparator(rule.getGroupingSeparator());
            symbols.setMonetaryGroupingSeparator(rule.getGroupingSeparator());
        }
        if (symbols.getDecimalSeparator() == symbols.getGroupingSeparator()) {
            throw new IllegalArgumentException("Decimal and grouping separators must differ: '"
                    + symbols.getDecimalSeparator() + "'");
        }
        DateTimeFormatter pattern = null;
        if (StringUtils.isNotBlank(rule.getDatePattern())) {
            String normalized = normalizeDatePattern(rule.getDatePattern());
            pattern = DateTimeFormatter.ofPattern(normalized, locale)
                    .withResolverStyle(ResolverStyle.STRICT);
        }
        return new ValueCoercer(column, rule, pattern, symbols);
    }

    /**
     * Rewrites spreadsheet-style date tokens into {@link DateTimeFormatter} letters.
     *
     * <p>
     * {@code D} becomes {@code d} (day of month) and {@code Y}/{@code y} become {@code u}
     * (proleptic year, required by strict resolution). Quoted literals are left untouched.
     * </p>
     *
     * @param pattern user pattern such as {@code DD/MM/YYYY}
     * @return formatter pattern such as {@code dd/MM/uuuu}
     */
    static String normalizeDatePattern(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
                sb.append(c);
            } else if (quoted) {
                sb.append(c);
            } else if (c == 'D') {
                sb.append('d');
            } else if (c == 'Y' || c == 'y') {
                sb.append('u');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Converts one raw value.
     *
     * @param raw value from the source row or a mapping constant
     * @return converted value, {@code null} for empty input
     * @throws CoercionException if the value cannot be represented in the column's type
     */
    Object coerce(Object raw) throws CoercionException {
        Object value = raw;
        if (value instanceof String) {
            String text = (String) value;
            if (rule.isTrim()) {
                text = text.trim();
            }
            if (rule.isBlankAsNull() && StringUtils.isBlank(text)) {
                return null;
            }
            value = text;
        }
        if (value == null) {
            return null;
        }
        switch (column.getKind()) {
            case TEXT:
                return toText(value);
            case INTEGER:
                return toInteger(value);
            case DECIMAL:
                return toDecimal(value);
            case DATE:
                return toDate(value);
            case DATETIME:
                return toDateTime(value);
            case TIME:
                return toTime(value);
            case BOOLEAN:
                return toBoolean(value);
            case BINARY:
                return toBinary(value);
            default:
                return value;
        }
    }

    private String toText(Object value) throws CoercionException {
        String text;
        if (value instanceof BigDecimal) {
            text = plain((BigDecimal) value);
        } else if (value instanceof LocalDateTime) {
            LocalDateTime dateTime = (LocalDateTime) value;
            text = dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)
                    ? dateTime.toLocalDate().toString()
                    : dateTime.toString();
        } else if (value instanceof byte[]) {
            text = Hex.encodeHexString((byte[]) value);
        } else {
            text = value.toString();
        }
        if (column.getSize() > 0 && text.length() > column.getSize()) {
            throw new CoercionException("length " + text.length() + " exceeds column size "
                    + column.getSize());
        }
        return text;
    }

    private Object toInteger(Object value) throws CoercionException {
        BigDecimal number = toDecimal(value);
        BigDecimal integral = number.stripTrailingZeros();
        if (integral.scale() > 0) {
            throw new CoercionException("not an integer: " + plain(number));
        }
        long result;
        try {
            result = integral.longValueExact();
        } catch (ArithmeticException e) {
            throw new CoercionException("out of range: " + plain(number), e);
        }
        int jdbcType = column.getJdbcType();
        if (jdbcType == Types.BIGINT) {
            return result;
        }
        long min = Integer.MIN_VALUE;
        long max = Integer.MAX_VALUE;
        if (jdbcType == Types.SMALLINT) {
            min = Short.MIN_VALUE;
            max = Short.MAX_VALUE;
        } else if (jdbcType == Types.TINYINT) {
            // Signed in MySQL, unsigned in SQL Server
            min = Byte.MIN_VALUE;
            max = 255;
        }
        if (result < min || result > max) {
            throw new CoercionException("out of range for " + column.getTypeName() + ": " + result);
        }
        return (int) result;
    }

    private BigDecimal toDecimal(Object value) throws CoercionException {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof String) {
            return parseDecimal((String) value);
        }
        throw unsupported(value);
    }

    private BigDecimal parseDecimal(String text) throws CoercionException {
        String candidate = text.startsWith("+") ? text.substring(1) : text;
        DecimalFormat format = new DecimalFormat("#,##0.#", symbols);
        format.setParseBigDecimal(true);
        ParsePosition position = new ParsePosition(0);
        Number parsed = format.parse(candidate, position);
        if (parsed != null && position.getErrorIndex() < 0
                && position.getIndex() == candidate.length()) {
            return (BigDecimal) parsed;
        }
        if (symbols.getDecimalSeparator() == '.') {
            try {
                return new BigDecimal(candidate);
            } catch (NumberFormatException e) {
                throw new CoercionException("not a number: '" + text + "'", e);
            }
        }
        throw new CoercionException("not a number: '" + text + "'");
    }

    private LocalDate toDate(Object value) throws CoercionException {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        LocalDateTime dateTime = toDateTime(value);
        if (!dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            throw new CoercionException("date value carries a time of day: " + dateTime);
        }
        return dateTime.toLocalDate();
    }

    private LocalDateTime toDateTime(Object value) throws CoercionException {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof BigDecimal) {
            return fromSerial((BigDecimal) value);
        }
        if (value instanceof String) {
            return parseDateTime((String) value);
        }
        throw unsupported(value);
    }

    private LocalTime toTime(Object value) throws CoercionException {
        if (value instanceof LocalTime) {
            return (LocalTime) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalTime();
        }
        if (value instanceof BigDecimal) {
            return fromSerial((BigDecimal) value).toLocalTime();
        }
        if (value instanceof String) {
            String text = (String) value;
            if (datePattern != null) {
                TemporalAccessor parsed = parseWithPattern(text);
                if (parsed instanceof LocalDateTime) {
                    return ((LocalDateTime) parsed).toLocalTime();
                }
                if (parsed instanceof LocalTime) {
                    return (LocalTime) parsed;
                }
                throw new CoercionException("pattern '" + rule.getDatePattern()
                        + "' does not describe a time: '" + text + "'");
            }
            for (DateTimeFormatter formatter : FallbackDateFormats.TIMES) {
                LocalTime time = tryParse(text, formatter, LocalTime::from);
                if (time != null) {
                    return time;
                }
            }
            throw new CoercionException("not a time: '" + text + "'");
        }
        throw unsupported(value);
    }

    private LocalDateTime parseDateTime(String text) throws CoercionException {
        if (datePattern != null) {
            TemporalAccessor parsed = parseWithPattern(text);
            if (parsed instanceof LocalDateTime) {
                return (LocalDateTime) parsed;
            }
            if (parsed instanceof LocalDate) {
                return ((LocalDate) parsed).atStartOfDay();
            }
            throw new CoercionException("pattern '" + rule.getDatePattern()
                    + "' does not describe a date: '" + text + "'");
        }
        for (DateTimeFormatter formatter : FallbackDateFormats.DATE_TIMES) {
            LocalDateTime dateTime = tryParse(text, formatter, LocalDateTime::from);
            if (dateTime != null) {
                return dateTime;
            }
        }
        for (DateTimeFormatter formatter : FallbackDateFormats.DATES) {
            LocalDate date = tryParse(text, formatter, LocalDate::from);
            if (date != null) {
                return date.atStartOfDay();
            }
        }
        throw new CoercionException("not a date: '" + text + "'");
    }

    private static <T> T tryParse(String text, DateTimeFormatter formatter,
            TemporalQuery<T> query) {
        try {
            return formatter.parse(text, query);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private TemporalAccessor parseWithPattern(String text) throws CoercionException {
        try {
            return datePattern.parseBest(text, LocalDateTime::from, LocalDate::from,
                    LocalTime::from);
        } catch (DateTimeParseException e) {
            throw new CoercionException(
                    "'" + text + "' does not match pattern '" + rule.getDatePattern() + "'", e);
        }
    }

    private static LocalDateTime fromSerial(BigDecimal serial) throws CoercionException {
        double value = serial.doubleValue();
        if (!DateUtil.isValidExcelDate(value)) {
            throw new CoercionException("not a spreadsheet date serial: " + plain(serial));
        }
        return DateUtil.getLocalDateTime(value);
    }

    private Boolean toBoolean(Object value) throws CoercionException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            if (number.compareTo(BigDecimal.ONE) == 0) {
                return Boolean.TRUE;
            }
            if (number.signum() == 0) {
                return Boolean.FALSE;
            }
            throw new CoercionException("not a boolean: " + plain(number));
        }
        if (value instanceof String) {
            String token = ((String) value).trim().toLowerCase(Locale.ROOT);
            switch (token) {
                case "true":
                case "yes":
                case "y":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "no":
                case "n":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw new CoercionException("not a boolean: '" + value + "'");
            }
        }
        throw unsupported(value);
    }

    private byte[] toBinary(Object value) throws CoercionException {
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (!(value instanceof String)) {
            throw unsupported(value);
        }
        String text = (String) value;
        if (rule.getBinaryEncoding() == CoercionRule.BinaryEncoding.BASE64) {
            try {
                return BaseEncoding.base64().decode(text);
            } catch (IllegalArgumentException e) {
                throw new CoercionException("not base64: '" + StringUtils.abbreviate(text, 40) + "'",
                        e);
            }
        }
        String hex = StringUtils.startsWithIgnoreCase(text, "0x") ? text.substring(2) : text;
        try {
            return Hex.decodeHex(hex);
        } catch (DecoderException e) {
            throw new CoercionException("not hexadecimal: '" + StringUtils.abbreviate(text, 40)
                    + "'", e);
        }
    }

    private CoercionException unsupported(Object value) {
        return new CoercionException("cannot convert " + value.getClass().getSimpleName() + " '"
                + value + "' to " + column.getKind());
    }

    private static String plain(BigDecimal number) {
        return number.stripTrailingZeros().toPlainString();
    }
}
