package com.ai.concierge.service;

import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.conversation.DateValidation;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAdjusters;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses natural-language stay dates ("march 11 to march 14", "3-5 feb",
 * "12/3/2026 to 15/3/2026", "on 5 april") into a {@link DateRange}.
 * Years default to the current year; a range whose end falls before its start
 * rolls the end into the next month or year.
 */
@Service
public class DateExtractor {

    private static final Logger log = LoggerFactory.getLogger(DateExtractor.class);

    private static final int MAX_NIGHTS = 30;
    private static final int MAX_DAYS_IN_PAST = 365;
    private static final int MAX_DAYS_AHEAD = 730;

    private static final String MONTH = "(january|february|march|april|may|june|july|august|september|october|november|december"
            + "|jan|feb|mar|apr|jun|jul|aug|sept|sep|oct|nov|dec)";
    private static final String DAY = "(\\d{1,2})(?!\\d)(?:st|nd|rd|th)?";
    private static final String NOT_A_COUNT = "(?!\\s*(?:people|persons?|guests?|members?|adults?|kids|children|of us|nights?|days?)\\b)";
    private static final String TO = "\\s*(?:to|until|till|through|-)\\s*";

    private static final Pattern MONTH_DAY_TO_MONTH_DAY = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + TO + MONTH + "\\s+" + DAY);

    private static final Pattern FULL_DATE_TO_FULL_DATE = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + ",?\\s*(\\d{4}|\\d{2})(?!\\d)" + TO + MONTH + "\\s+" + DAY + ",?\\s*(\\d{4}|\\d{2})(?!\\d)");

    private static final Pattern DAY_MONTH_TO_DAY_MONTH = Pattern.compile(
            "\\b" + DAY + "\\s+(?:of\\s+)?" + MONTH + TO + DAY + "\\s+(?:of\\s+)?" + MONTH + "\\b");

    private static final Pattern DAY_TO_DAY_MONTH = Pattern.compile(
            "\\b" + DAY + TO + DAY + "\\s+(?:of\\s+)?" + MONTH + "\\b");

    private static final Pattern MONTH_DAY_TO_DAY = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + TO + DAY);

    private static final Pattern NUMERIC_TO_NUMERIC = Pattern.compile(
            "\\b(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4}|\\d{2})(?!\\d)" + TO + "(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4}|\\d{2})(?!\\d)");

    private static final Pattern SINGLE_DAY_MONTH = Pattern.compile(
            "\\b" + DAY + NOT_A_COUNT + "\\s+(?:of\\s+)?" + MONTH + "\\b");

    private static final Pattern SINGLE_MONTH_DAY = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + NOT_A_COUNT);

    private static final List<DateRule> RULES = List.of(
            new DateRule("month-day-to-month-day", MONTH_DAY_TO_MONTH_DAY, (m, year) -> {
                LocalDate start = LocalDate.of(year, month(m.group(1)), day(m.group(2)));
                LocalDate end = LocalDate.of(year, month(m.group(3)), day(m.group(4)));
                return DateRange.of(start, end.isBefore(start) ? end.plusYears(1) : end);
            }),
            new DateRule("full-date-to-full-date", FULL_DATE_TO_FULL_DATE, (m, year) -> DateRange.of(
                    LocalDate.of(fullYear(m.group(3)), month(m.group(1)), day(m.group(2))),
                    LocalDate.of(fullYear(m.group(6)), month(m.group(4)), day(m.group(5))))),
            new DateRule("day-month-to-day-month", DAY_MONTH_TO_DAY_MONTH, (m, year) -> {
                LocalDate start = LocalDate.of(year, month(m.group(2)), day(m.group(1)));
                LocalDate end = LocalDate.of(year, month(m.group(4)), day(m.group(3)));
                return DateRange.of(start, end.isBefore(start) ? end.plusYears(1) : end);
            }),
            new DateRule("day-to-day-month", DAY_TO_DAY_MONTH, (m, year) -> {
                int month = month(m.group(3));
                LocalDate start = LocalDate.of(year, month, day(m.group(1)));
                LocalDate end = LocalDate.of(year, month, day(m.group(2)));
                return DateRange.of(start, end.isBefore(start) ? end.plusMonths(1) : end);
            }),
            new DateRule("month-day-to-day", MONTH_DAY_TO_DAY, (m, year) -> {
                int month = month(m.group(1));
                LocalDate start = LocalDate.of(year, month, day(m.group(2)));
                LocalDate end = LocalDate.of(year, month, day(m.group(3)));
                return DateRange.of(start, end.isBefore(start) ? end.plusMonths(1) : end);
            }),
            new DateRule("numeric-to-numeric", NUMERIC_TO_NUMERIC, (m, year) -> DateRange.of(
                    LocalDate.of(fullYear(m.group(3)), Integer.parseInt(m.group(2)), day(m.group(1))),
                    LocalDate.of(fullYear(m.group(6)), Integer.parseInt(m.group(5)), day(m.group(4))))),
            new DateRule("single-day-month", SINGLE_DAY_MONTH, (m, year) -> {
                LocalDate start = LocalDate.of(year, month(m.group(2)), day(m.group(1)));
                return DateRange.of(start, start.plusDays(1));
            }),
            new DateRule("single-month-day", SINGLE_MONTH_DAY, (m, year) -> {
                LocalDate start = LocalDate.of(year, month(m.group(1)), day(m.group(2)));
                return DateRange.of(start, start.plusDays(1));
            }));

    private static final Pattern NEXT_WEEK = Pattern.compile("\\bnext\\s+week\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern AMBIGUOUS_MARCH = Pattern.compile("(?<=\\d\\s{0,3})\\bmatch\\b|\\bmatch\\b(?=\\s*\\d)");

    private static final Map<String, String> MONTH_TYPOS = new LinkedHashMap<>();

    static {
        MONTH_TYPOS.put("martch", "march");
        MONTH_TYPOS.put("marchh", "march");
        MONTH_TYPOS.put("feburary", "february");
        MONTH_TYPOS.put("febuary", "february");
        MONTH_TYPOS.put("februrary", "february");
        MONTH_TYPOS.put("janurary", "january");
        MONTH_TYPOS.put("januray", "january");
        MONTH_TYPOS.put("septmeber", "september");
        MONTH_TYPOS.put("decembr", "december");
    }

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            formatter("d MMM yyyy"),
            formatter("d MMMM yyyy"),
            formatter("MMMM d yyyy"),
            formatter("MMM d yyyy"),
            formatter("d/M/yyyy"),
            formatter("d-M-yyyy"));

    private static final List<DateTimeFormatter> DATE_FORMATS_WITHOUT_YEAR = List.of(
            formatter("d MMM"),
            formatter("d MMMM"),
            formatter("MMMM d"),
            formatter("MMM d"));

    private final Clock clock;

    public DateExtractor(Clock clock) {
        this.clock = clock;
    }

    public Optional<DateRange> extractDateRange(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        String t = correctMonthTypos(text.toLowerCase(Locale.ROOT));
        int year = today().getYear();
        for (DateRule rule : RULES) {
            Matcher m = rule.pattern().matcher(t);
            if (!m.find()) continue;
            try {
                DateRange range = rule.builder().build(m, year);
                log.debug("Date rule {} matched '{}' -> {}", rule.name(), m.group(), range.describe());
                return Optional.of(range);
            } catch (DateTimeException | IllegalArgumentException e) {
                log.debug("Ignoring impossible date '{}': {}", m.group(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Rejects stays that end before they start, start more than a year ago or
     * more than two years ahead, or run longer than 30 nights.
     */
    public DateValidation validateDateRange(DateRange range) {
        if (range == null) return DateValidation.invalid("No dates were given.");
        if (!range.end().isAfter(range.start())) {
            return DateValidation.invalid("Check-out date must be after check-in date.");
        }
        LocalDate today = today();
        if (range.start().isBefore(today.minusDays(MAX_DAYS_IN_PAST))) {
            return DateValidation.invalid("Check-in date is too far in the past.");
        }
        if (range.start().isAfter(today.plusDays(MAX_DAYS_AHEAD))) {
            return DateValidation.invalid("Check-in date is too far in the future.");
        }
        if (range.nights() > MAX_NIGHTS) {
            return DateValidation.invalid("Stays longer than " + MAX_NIGHTS + " nights need to be arranged directly with the manager.");
        }
        return DateValidation.ok();
    }

    /** Parses a single date in one of the accepted formats; dates without a year use the current year. */
    public Optional<LocalDate> parseDateString(String value) {
        if (StringUtils.isBlank(value)) return Optional.empty();
        String v = correctMonthTypos(value.trim().toLowerCase(Locale.ROOT).replace(",", ""));
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(v, format));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", v, format);
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS_WITHOUT_YEAR) {
            DateTimeFormatter withYear = new DateTimeFormatterBuilder()
                    .append(format)
                    .parseDefaulting(ChronoField.YEAR, today().getYear())
                    .toFormatter(Locale.ENGLISH);
            try {
                return Optional.of(LocalDate.parse(v, withYear));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", v, format);
            }
        }
        return Optional.empty();
    }

    public boolean mentionsNextWeek(String text) {
        return text != null && NEXT_WEEK.matcher(text).find();
    }

    /** The Monday after today. */
    public LocalDate nextMonday() {
        return today().with(TemporalAdjusters.next(DayOfWeek.MONDAY));
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    static String correctMonthTypos(String text) {
        String corrected = text;
        for (Map.Entry<String, String> typo : MONTH_TYPOS.entrySet()) {
            corrected = corrected.replaceAll("\\b" + typo.getKey() + "\\b", typo.getValue());
        }
        // "match" is only a misspelt month next to a day number
        corrected = AMBIGUOUS_MARCH.matcher(corrected).replaceAll("march");
        return corrected;
    }

    private static int month(String name) {
        return switch (name.substring(0, 3)) {
            case "jan" -> 1;
            case "feb" -> 2;
            case "mar" -> 3;
            case "apr" -> 4;
            case "may" -> 5;
            case "jun" -> 6;
            case "jul" -> 7;
            case "aug" -> 8;
            case "sep" -> 9;
            case "oct" -> 10;
            case "nov" -> 11;
            case "dec" -> 12;
            default -> throw new IllegalArgumentException("Unknown month " + name);
        };
    }

    private static int day(String value) {
        return Integer.parseInt(value);
    }

    private static int fullYear(String value) {
        int year = Integer.parseInt(value);
        return year < 100 ? 2000 + year : year;
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    @FunctionalInterface
    private interface RangeBuilder {
        DateRange build(Matcher m, int year);
    }

    private record DateRule(String name, Pattern pattern, RangeBuilder builder) {
    }
}
