package io.github.yok.sheetlink.mapping;

import lombok.Builder;
import lombok.Value;

/**
 * Per-mapping hints for converting a source value to the target column's type.
 *
 * <p>
 * Every attribute is optional. Date patterns accept the usual spreadsheet spelling, so
 * {@code DD/MM/YYYY} means day of month, month and year.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class CoercionRule {

    /**
     * Rule with all defaults: trimmed strings, blanks as {@code null}, locale from configuration.
     */
    public static final CoercionRule DEFAULT = CoercionRule.builder().build();

    /**
     * Encodings accepted for binary columns.
     */
    public enum BinaryEncoding {
        HEX, BASE64
    }

    // Pattern for date and time strings (e.g., DD/MM/YYYY)
    String datePattern;

    // BCP 47 language tag for numeric parsing (e.g., de-DE)
    String locale;

    // Overrides the locale's decimal separator
    Character decimalSeparator;

    // Overrides the locale's grouping separator
    Character groupingSeparator;

    // Strip leading and trailing whitespace from strings
    @Builder.Default
    boolean trim = true;

    // Treat empty or whitespace-only strings as null
    @Builder.Default
    boolean blankAsNull = true;

    // Encoding of binary values written as text
    @Builder.Default
    BinaryEncoding binaryEncoding = BinaryEncoding.HEX;
}
