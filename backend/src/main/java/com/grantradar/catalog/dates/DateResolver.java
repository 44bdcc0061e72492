package com.grantradar.catalog.dates;

import com.grantradar.catalog.model.DateResolution;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the date shapes found in scraped listings into calendar dates. Nothing here throws on
 * bad input; a value that cannot be read comes back as {@link DateResolution.Status#UNRESOLVED}.
 */
public final class DateResolver {
    public static final Pattern DEFAULT_CLOSE_MARKER = Pattern.compile(
        "(close[sd]?|deadline)[^0-9A-Za-z]{0,10}([A-Za-z0-9 ,/\\-:]+)",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NUMERIC_DATE = Pattern.compile("^(\\d{1,4})[/\\-.](\\d{1,2})[/\\-.](\\d{1,4})$");
    private static final Pattern DAY_TOKEN = Pattern.compile("^(\\d{1,2})(st|nd|rd|th)?$");
    private static final Pattern YEAR_TOKEN = Pattern.compile("^(\\d{4}|'?\\d{2})$");
    private static final Pattern TIME_TOKEN = Pattern.compile("^(\\d{1,2}(:\\d{2}){1,2}(am|pm)?|\\d{1,2}(am|pm)|am|pm)$");
    private static final Pattern SEPARATOR_TOKEN = Pattern.compile("^[/\\-:]+$");

    private static final Set<String> FILLER_WORDS = Set.of("at", "on", "and", "of", "st", "nd", "rd", "th");
    private static final Set<String> WEEKDAYS = Set.of(
        "mon", "monday", "tue", "tues", "tuesday", "wed", "wednesday", "thu", "thur", "thurs", "thursday",
        "fri", "friday", "sat", "saturday", "sun", "sunday"
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("january", 1),
        Map.entry("feb", 2), Map.entry("february", 2),
        Map.entry("mar", 3), Map.entry("march", 3),
        Map.entry("apr", 4), Map.entry("april", 4),
        Map.entry("may", 5),
        Map.entry("jun", 6), Map.entry("june", 6),
        Map.entry("jul", 7), Map.entry("july", 7),
        Map.entry("aug", 8), Map.entry("august", 8),
        Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
        Map.entry("oct", 10), Map.entry("october", 10),
        Map.entry("nov", 11), Map.entry("november", 11),
        Map.entry("dec", 12), Map.entry("december", 12)
    );

    private DateResolver() {
    }

    /**
     * Strict calendar date, then the same with {@code /} read as {@code -}.
     */
    public static DateResolution resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return DateResolution.absent();
        }
        String candidate = raw.trim();
        LocalDate date = parseIsoDate(candidate);
        if (date == null) {
            date = parseIsoDate(candidate.replace('/', '-'));
        }
        return date == null ? DateResolution.unresolved(raw) : DateResolution.resolved(date);
    }

    /**
     * Like {@link #resolve(String)} but also accepts ISO date-times (with or without a trailing
     * {@code Z} or offset), keeping only the calendar date as written.
     */
    public static DateResolution resolveTimestamp(String raw) {
        DateResolution asDate = resolve(raw);
        if (asDate.status() != DateResolution.Status.UNRESOLVED) {
            return asDate;
        }
        String candidate = raw.trim().replace('/', '-');
        if (!candidate.contains("T") && !candidate.contains(" ")) {
            return asDate;
        }
        try {
            return DateResolution.resolved(OffsetDateTime.parse(candidate.replace(' ', 'T')).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // fall through to the zone-less form
        }
        String local = candidate.replace("Z", "").replace(' ', 'T');
        try {
            return DateResolution.resolved(LocalDateTime.parse(local).toLocalDate());
        } catch (DateTimeParseException ignored) {
            return asDate;
        }
    }

    /**
     * Looks for a closing-date phrase such as "Applications close 30 June 2025" and reads the
     * date that follows the marker, day before month. Returns null when no marker is present
     * or the text after it holds no readable date.
     */
    public static LocalDate extractCloseDate(String text, Pattern marker, LocalDate today) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = (marker == null ? DEFAULT_CLOSE_MARKER : marker).matcher(text);
        if (!matcher.find() || matcher.groupCount() < 2 || matcher.group(2) == null) {
            return null;
        }
        return parseDayFirst(matcher.group(2), today);
    }

    /**
     * Reads a free-text date with Australian day-before-month precedence. Handles numeric
     * dates ({@code 30/06/2025}, {@code 2025-06-30}) and named months ({@code 30 June 2025},
     * {@code Friday 14 March}, {@code June 3rd, 2024 at 5pm}). Every token has to be part of
     * the date, a weekday, a time of day or one of the filler words {@code at on and of};
     * anything else makes the whole candidate unreadable. A missing year defaults to the
     * reference year and a missing day to the reference day, clamped to the month's length.
     */
    public static LocalDate parseDayFirst(String candidate, LocalDate today) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        LocalDate reference = today == null ? LocalDate.now() : today;
        LocalDate numericDate = null;
        Integer day = null;
        Integer month = null;
        Integer year = null;
        for (String raw : candidate.trim().split("[\\s,]+")) {
            String token = raw.toLowerCase(Locale.ROOT);
            if (token.isEmpty() || SEPARATOR_TOKEN.matcher(token).matches()
                || FILLER_WORDS.contains(token) || WEEKDAYS.contains(token)
                || TIME_TOKEN.matcher(token).matches()) {
                continue;
            }
            Matcher numeric = NUMERIC_DATE.matcher(token);
            if (numeric.matches()) {
                if (numericDate != null) {
                    return null;
                }
                numericDate = fromNumeric(numeric.group(1), numeric.group(2), numeric.group(3));
                if (numericDate == null) {
                    return null;
                }
                continue;
            }
            Integer monthOfToken = MONTHS.get(token);
            if (monthOfToken != null) {
                if (month != null) {
                    return null;
                }
                month = monthOfToken;
                continue;
            }
            Integer dayOfToken = dayOf(token);
            if (dayOfToken != null && day == null) {
                day = dayOfToken;
                continue;
            }
            Integer yearOfToken = yearOf(token);
            if (yearOfToken != null && year == null) {
                year = yearOfToken;
                continue;
            }
            return null;
        }

        if (numericDate != null) {
            return day == null && month == null && year == null ? numericDate : null;
        }
        if (month == null) {
            return null;
        }
        return build(
            year == null ? reference.getYear() : year,
            month,
            day == null ? reference.getDayOfMonth() : day,
            day == null
        );
    }

    private static LocalDate fromNumeric(String first, String second, String third) {
        if (first.length() == 4) {
            return build(Integer.parseInt(first), Integer.parseInt(second), Integer.parseInt(third), false);
        }
        if (third.length() == 3) {
            return null;
        }
        int year = Integer.parseInt(third);
        if (third.length() <= 2) {
            year += 2000;
        }
        return build(year, Integer.parseInt(second), Integer.parseInt(first), false);
    }

    private static Integer dayOf(String token) {
        Matcher matcher = DAY_TOKEN.matcher(token.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        int day = Integer.parseInt(matcher.group(1));
        return day >= 1 && day <= 31 ? day : null;
    }

    private static Integer yearOf(String token) {
        Matcher matcher = YEAR_TOKEN.matcher(token);
        if (!matcher.matches()) {
            return null;
        }
        String digits = matcher.group(1).replace("'", "");
        int year = Integer.parseInt(digits);
        return digits.length() == 2 ? 2000 + year : year;
    }

    private static LocalDate build(int year, int month, int day, boolean clampDay) {
        if (month < 1 || month > 12 || day < 1) {
            return null;
        }
        int safeDay = clampDay ? Math.min(day, YearMonth.of(year, month).lengthOfMonth()) : day;
        try {
            return LocalDate.of(year, month, safeDay);
        } catch (DateTimeException ignored) {
            return null;
        }
    }

    private static LocalDate parseIsoDate(String candidate) {
        try {
            return LocalDate.parse(candidate);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
