package io.github.yok.sheetlink.mapping;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;
import lombok.Generated;

/**
 * Formats tried, in order, for text cells of temporal columns whose mapping declares no pattern.
 *
 * @author Yasuharu.Okawauchi
 */
final class FallbackDateFormats {

    // HH:mm[:ss[.fraction]] and HHmm[ss[.fraction]]
    static final DateTimeFormatter[] TIMES = {time("HH:mm", ":ss"), time("HHmm", "ss")};

    static final DateTimeFormatter[] DATES = {DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"), DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ofPattern("yyyy.MM.dd"),
            DateTimeFormatter.ofPattern("yyyy年M月d日", Locale.JAPANESE)};

    // ISO with 'T', then a date, one space and a colon-separated time
    static final DateTimeFormatter[] DATE_TIMES = {DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            dateTime("yyyy-MM-dd"), dateTime("yyyy/MM/dd")};

    @Generated
    private FallbackDateFormats() {
    }

    private static DateTimeFormatter time(String hoursMinutes, String seconds) {
        return new DateTimeFormatterBuilder().appendPattern(hoursMinutes).optionalStart()
                .appendPattern(seconds).optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd().toFormatter();
    }

    private static DateTimeFormatter dateTime(String datePattern) {
        return new DateTimeFormatterBuilder().appendPattern(datePattern).appendLiteral(' ')
                .append(TIMES[0]).toFormatter();
    }
}
