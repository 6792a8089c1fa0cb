package com.ai.concierge.conversation;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * A stay: check-in, check-out and every night in between.
 * <p>
 * Night counts are derived from the explicit night list, so
 * {@code weekdayNights() + weekendNights() == nights()} always holds and a
 * range always has at least one night. Saturday and Sunday nights are weekend
 * nights.
 * </p>
 * <p>
 * A range built by {@link #of} is consecutive and spans exactly {@code nights()}
 * days. One built by {@link #ofNights} may skip days, so its check-out can lie
 * further out than the night count.
 * </p>
 */
public record DateRange(LocalDate start, LocalDate end, List<LocalDate> nightDates) {

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (nightDates == null || nightDates.isEmpty()) {
            throw new IllegalArgumentException("a stay has at least one night");
        }
        nightDates = List.copyOf(nightDates);
    }

    /**
     * Consecutive nights from {@code start} up to the day before {@code end}.
     * An end on or before the start is moved to the day after the start.
     */
    public static DateRange of(LocalDate start, LocalDate end) {
        LocalDate checkout = end.isAfter(start) ? end : start.plusDays(1);
        List<LocalDate> nights = new ArrayList<>();
        for (LocalDate d = start; d.isBefore(checkout); d = d.plusDays(1)) {
            nights.add(d);
        }
        return new DateRange(start, checkout, nights);
    }

    /** A stay over an explicit, possibly non-consecutive, list of nights. */
    public static DateRange ofNights(List<LocalDate> nights) {
        List<LocalDate> sorted = new ArrayList<>(nights);
        Collections.sort(sorted);
        return new DateRange(sorted.get(0), sorted.get(sorted.size() - 1).plusDays(1), sorted);
    }

    public int nights() {
        return nightDates.size();
    }

    public int weekendNights() {
        return (int) nightDates.stream().filter(DateRange::isWeekend).count();
    }

    public int weekdayNights() {
        return nights() - weekendNights();
    }

    public boolean isConsecutive() {
        return ChronoUnit.DAYS.between(start, end) == nights();
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public String describe() {
        String count = nights() + " night" + (nights() == 1 ? "" : "s");
        if (isConsecutive()) {
            return DISPLAY.format(start) + " to " + DISPLAY.format(end) + " (" + count + ")";
        }
        return count + " on " + nightDates.stream().map(DISPLAY::format).collect(Collectors.joining(", "));
    }
}
