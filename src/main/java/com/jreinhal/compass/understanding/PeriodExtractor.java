package com.jreinhal.compass.understanding;

import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Period handling for queries and stored metadata. All periods are {@code YYYYMM} strings;
 * year-level filters are {@code YYYY}.
 *
 * "Now" always comes from the supplied {@link Clock}.
 */
public final class PeriodExtractor {
    private static final DateTimeFormatter YYYYMM = DateTimeFormatter.ofPattern("yyyyMM");

    private static final Pattern FULL_KOREAN = Pattern.compile("((?:19|20)\\d{2})\\s*년\\s*(\\d{1,2})\\s*월");
    private static final Pattern ISO_MONTH = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})[-./](\\d{1,2})(?!\\d)");
    private static final Pattern COMPACT_MONTH = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(0[1-9]|1[0-2])(?!\\d)");
    private static final Pattern CURRENT_MONTH = Pattern.compile("이번\\s*달|이달|금월|현재|this\\s*month", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREVIOUS_MONTH = Pattern.compile("지난\\s*달|전월|전달|last\\s*month", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_ONLY = Pattern.compile("(?<!\\d)(\\d{1,2})\\s*월");
    private static final Pattern CURRENT_YEAR = Pattern.compile("올해|금년|this\\s*year", Pattern.CASE_INSENSITIVE);
    private static final Pattern LAST_YEAR = Pattern.compile("작년|전년|last\\s*year", Pattern.CASE_INSENSITIVE);

    private static final Pattern SIX_DIGITS = Pattern.compile("^\\d{6}$");
    private static final Pattern FOUR_DIGITS = Pattern.compile("^\\d{4}$");
    private static final Pattern ONE_OR_TWO_DIGITS = Pattern.compile("^\\d{1,2}$");

    /**
     * Result of scanning a query. At most one of {@code period} and {@code year} is set.
     */
    public record PeriodFilter(String period, String year) {
        public static final PeriodFilter NONE = new PeriodFilter(null, null);

        public static PeriodFilter ofPeriod(String period) {
            return new PeriodFilter(period, null);
        }

        public static PeriodFilter ofYear(String year) {
            return new PeriodFilter(null, year);
        }

        public boolean isEmpty() {
            return period == null && year == null;
        }
    }

    private PeriodExtractor() {}

    /**
     * Finds temporal language in a free-text query. Explicit dates win over relative terms;
     * no temporal language yields {@link PeriodFilter#NONE}.
     */
    public static PeriodFilter extract(String query, Clock clock) {
        if (query == null || query.isBlank()) {
            return PeriodFilter.NONE;
        }
        YearMonth now = YearMonth.now(clock);

        Matcher full = FULL_KOREAN.matcher(query);
        if (full.find()) {
            String period = toPeriod(Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)));
            if (period != null) {
                return PeriodFilter.ofPeriod(period);
            }
        }
        Matcher iso = ISO_MONTH.matcher(query);
        if (iso.find()) {
            String period = toPeriod(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)));
            if (period != null) {
                return PeriodFilter.ofPeriod(period);
            }
        }
        Matcher compact = COMPACT_MONTH.matcher(query);
        if (compact.find()) {
            return PeriodFilter.ofPeriod(compact.group(1) + compact.group(2));
        }
        if (CURRENT_MONTH.matcher(query).find()) {
            return PeriodFilter.ofPeriod(now.format(YYYYMM));
        }
        if (PREVIOUS_MONTH.matcher(query).find()) {
            return PeriodFilter.ofPeriod(now.minusMonths(1).format(YYYYMM));
        }
        Matcher month = MONTH_ONLY.matcher(query);
        while (month.find()) {
            String period = toPeriod(now.getYear(), Integer.parseInt(month.group(1)));
            if (period != null) {
                return PeriodFilter.ofPeriod(period);
            }
        }
        if (CURRENT_YEAR.matcher(query).find()) {
            return PeriodFilter.ofYear(String.valueOf(now.getYear()));
        }
        if (LAST_YEAR.matcher(query).find()) {
            return PeriodFilter.ofYear(String.valueOf(now.getYear() - 1));
        }
        return PeriodFilter.NONE;
    }

    /**
     * Every explicit month mentioned in the query, in order of appearance and without
     * duplicates. Used for comparisons such as {@code 10월과 11월 비교}.
     */
    public static List<String> explicitPeriods(String query, Clock clock) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int year = YearMonth.now(clock).getYear();
        Set<String> periods = new LinkedHashSet<>();
        Matcher full = FULL_KOREAN.matcher(query);
        while (full.find()) {
            String period = toPeriod(Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)));
            if (period != null) {
                periods.add(period);
            }
        }
        String remaining = FULL_KOREAN.matcher(query).replaceAll(" ");
        Matcher month = MONTH_ONLY.matcher(remaining);
        while (month.find()) {
            String period = toPeriod(year, Integer.parseInt(month.group(1)));
            if (period != null) {
                periods.add(period);
            }
        }
        return List.copyOf(periods);
    }

    /**
     * Normalizes a period value from model output or user input into {@code YYYYMM}
     * (or {@code YYYY} for year terms). Unrecognised input is returned with separators removed.
     */
    public static String normalize(String input, Clock clock) {
        if (input == null || input.isBlank()) {
            return null;
        }
        YearMonth now = YearMonth.now(clock);
        String trimmed = input.trim();
        switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "latest", "이번달", "이번 달", "현재", "금월", "current", "this_month":
                return now.format(YYYYMM);
            case "previous", "지난달", "지난 달", "전월", "전달", "last_month", "prev":
                return now.minusMonths(1).format(YYYYMM);
            case "current_year", "올해", "this_year":
                return String.valueOf(now.getYear());
            case "last_year", "작년", "전년", "prev_year":
                return String.valueOf(now.getYear() - 1);
            default:
                break;
        }

        String cleaned = trimmed.replaceAll("[-/.]", "");
        if (SIX_DIGITS.matcher(cleaned).matches()) {
            return cleaned;
        }
        Matcher iso = ISO_MONTH.matcher(trimmed);
        if (iso.matches()) {
            String period = toPeriod(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)));
            if (period != null) {
                return period;
            }
        }
        if (ONE_OR_TWO_DIGITS.matcher(trimmed).matches()) {
            String period = toPeriod(now.getYear(), Integer.parseInt(trimmed));
            if (period != null) {
                return period;
            }
        }
        Matcher full = FULL_KOREAN.matcher(trimmed);
        if (full.find()) {
            String period = toPeriod(Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)));
            if (period != null) {
                return period;
            }
        }
        Matcher month = MONTH_ONLY.matcher(trimmed);
        if (month.find()) {
            String period = toPeriod(now.getYear(), Integer.parseInt(month.group(1)));
            if (period != null) {
                return period;
            }
        }
        return cleaned.isEmpty() ? trimmed : cleaned;
    }

    public static String current(Clock clock) {
        return YearMonth.now(clock).format(YYYYMM);
    }

    /**
     * Month before the given {@code YYYYMM} period.
     */
    public static String previous(String period) {
        if (!isValid(period)) {
            throw new IllegalArgumentException("Not a YYYYMM period: " + period);
        }
        return YearMonth.parse(period, YYYYMM).minusMonths(1).format(YYYYMM);
    }

    public static boolean isValid(String period) {
        if (period == null || !SIX_DIGITS.matcher(period).matches()) {
            return false;
        }
        int month = Integer.parseInt(period.substring(4, 6));
        return month >= 1 && month <= 12;
    }

    /**
     * Korean display form: {@code 202509 -> 2025년 9월}, {@code 2025 -> 2025년}.
     */
    public static String formatForDisplay(String period) {
        if (period == null || period.isBlank()) {
            return "";
        }
        if (FOUR_DIGITS.matcher(period).matches()) {
            return period + "년";
        }
        if (SIX_DIGITS.matcher(period).matches()) {
            return period.substring(0, 4) + "년 " + Integer.parseInt(period.substring(4, 6)) + "월";
        }
        return period;
    }

    private static String toPeriod(int year, int month) {
        if (month < 1 || month > 12) {
            return null;
        }
        return String.format("%04d%02d", year, month);
    }
}
