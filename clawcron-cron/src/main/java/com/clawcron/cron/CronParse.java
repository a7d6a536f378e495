package com.clawcron.cron;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Absolute time parsing for "at" schedules.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPACT_OFFSET_RE = Pattern.compile("([+-]\\d{2})(\\d{2})$");
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /**
     * Normalize an ISO date or date-time to one carrying an explicit offset.
     * Date-only input means midnight UTC; a date-time without zone means UTC;
     * a compact offset ({@code +0800}) gains its colon.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find()) {
            Matcher compact = COMPACT_OFFSET_RE.matcher(raw);
            return compact.find() ? compact.replaceFirst("$1:$2") : raw;
        }
        if (ISO_DATE_RE.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ISO_DATE_TIME_RE.matcher(raw).find())
            return raw + "Z";
        return raw;
    }

    /**
     * Parse an absolute time: a positive epoch-millisecond number or an ISO-8601
     * date/date-time.
     *
     * @return the instant, or null if the input is not an absolute time
     */
    public static Instant parseAbsoluteTime(String input) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long ms = Long.parseLong(raw);
                return ms > 0 ? Instant.ofEpochMilli(ms) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            return OffsetDateTime.parse(normalizeUtcIso(raw)).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Epoch-millisecond form of {@link #parseAbsoluteTime(String)}.
     */
    public static Long parseAbsoluteTimeMs(String input) {
        Instant instant = parseAbsoluteTime(input);
        return instant != null ? instant.toEpochMilli() : null;
    }
}
