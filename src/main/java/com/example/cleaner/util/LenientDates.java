package com.example.cleaner.util;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient calendar-date coercion. A value is accepted if its date part matches one of the
 * known layouts and any trailing time-of-day part is a well-formed 24-hour or AM/PM time.
 * Impossible dates (e.g. 2001-02-30) are rejected. When day and month are ambiguous,
 * month-first wins. Year-only and year-month values resolve to the first day of the period.
 * Two-digit years fall in the hundred years starting fifty years before the current one.
 */
public final class LenientDates {

    private static final int TWO_DIGIT_YEAR_BASE = Year.now().getValue() - 50;

    private static final List<DateTimeFormatter> DATE_LAYOUTS = List.of(
            layout("uuuu-M-d"),     // ISO
            layout("uuuu/M/d"),
            layout("uuuu.M.d"),
            layout("uuuuMMdd"),
            layout("M/d/uuuu"),     // US first
            layout("d/M/uuuu"),
            layout("M-d-uuuu"),
            layout("d-M-uuuu"),
            layout("d.M.uuuu"),     // Central Europe
            layout("MMM d, uuuu"),
            layout("MMM d uuuu"),
            layout("MMMM d, uuuu"),
            layout("MMMM d uuuu"),
            layout("d MMM uuuu"),
            layout("d MMMM uuuu"),
            layout("d-MMM-uuuu"),
            layout("uuuu-MMM-d"),
            layout("MMM uuuu"),
            layout("MMMM uuuu"),
            layout("uuuu-M"),
            layout("uuuu/M"),
            twoDigitYear('/', true),
            twoDigitYear('/', false),
            twoDigitYear('-', true),
            twoDigitYear('-', false),
            twoDigitYear('.', false),
            new DateTimeFormatterBuilder()
                    .appendValue(ChronoField.YEAR, 4)
                    .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
                    .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                    .toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT)
    );

    // date, then optional [T or blanks] time with optional AM/PM, then optional zone
    private static final Pattern DATE_TIME = Pattern.compile(
            "^(.+?)(?:(?:T|\\s+)(\\d{1,2}:\\d{2}(?::\\d{2}(?:\\.\\d{1,9})?)?)(?:\\s*([AaPp][Mm]))?\\s*(Z|[+-]\\d{2}:?\\d{2})?)?$");

    private LenientDates() {}

    private static DateTimeFormatter layout(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter twoDigitYear(char separator, boolean monthFirst) {
        DateTimeFormatterBuilder b = new DateTimeFormatterBuilder()
                .appendValue(monthFirst ? ChronoField.MONTH_OF_YEAR : ChronoField.DAY_OF_MONTH)
                .appendLiteral(separator)
                .appendValue(monthFirst ? ChronoField.DAY_OF_MONTH : ChronoField.MONTH_OF_YEAR)
                .appendLiteral(separator)
                .appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
        return b.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses the value as a calendar date, discarding any time-of-day and zone.
     *
     * @return the date, or empty for null, blank or unparseable input
     */
    public static Optional<LocalDate> parse(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        if (v.isEmpty()) return Optional.empty();

        Matcher m = DATE_TIME.matcher(v);
        if (!m.matches()) return Optional.empty();
        String time = m.group(2);
        if (time != null && !isTime(time, m.group(3) != null)) return Optional.empty();

        String datePart = m.group(1).trim();
        for (DateTimeFormatter layout : DATE_LAYOUTS) {
            try {
                return Optional.of(LocalDate.parse(datePart, layout));
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return Optional.empty();
    }

    /** ISO {@code yyyy-MM-dd} form of the parsed date, or null. */
    public static String toIsoDate(String value) {
        return parse(value).map(DateTimeFormatter.ISO_LOCAL_DATE::format).orElse(null);
    }

    private static boolean isTime(String time, boolean twelveHour) {
        String t = time.indexOf(':') == time.lastIndexOf(':') ? time + ":00" : time;
        if (t.indexOf(':') == 1) t = "0" + t;
        try {
            LocalTime parsed = LocalTime.parse(t, DateTimeFormatter.ISO_LOCAL_TIME);
            return !twelveHour || (parsed.getHour() >= 1 && parsed.getHour() <= 12);
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
