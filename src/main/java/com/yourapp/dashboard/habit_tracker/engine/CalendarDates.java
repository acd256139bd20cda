package com.yourapp.dashboard.habit_tracker.engine;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar-date helpers working on {@code yyyy-MM-dd} strings.
 * <p>
 * All arithmetic happens on {@link LocalDate}, never on instants, so daylight-saving
 * transitions cannot shift a result. Weekdays are numbered 0..6 with Sunday = 0.
 */
public final class CalendarDates {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private CalendarDates() {
    }

    /**
     * Maps a wall-clock time to the calendar day it belongs to when days start at
     * {@code rolloverHour} instead of midnight, e.g. 02:30 with rollover 4 is still "yesterday".
     */
    public static String effectiveDate(LocalDateTime timestamp, int rolloverHour) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        requireRolloverHour(rolloverHour);
        return format(timestamp.minusHours(rolloverHour).toLocalDate());
    }

    public static LocalDate parse(String dateISO) {
        if (dateISO == null || dateISO.isBlank()) {
            throw new InvalidDateException(dateISO, null);
        }
        try {
            return LocalDate.parse(dateISO, ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(dateISO, e);
        }
    }

    public static String format(LocalDate date) {
        return ISO_DATE.format(date);
    }

    public static int dayOfWeek(String dateISO) {
        return dayOfWeek(parse(dateISO));
    }

    static int dayOfWeek(LocalDate date) {
        // java.time numbers Monday..Sunday as 1..7
        return date.getDayOfWeek().getValue() % 7;
    }

    /**
     * Signed number of calendar days from {@code from} to {@code to}.
     */
    public static long daysBetween(String from, String to) {
        return ChronoUnit.DAYS.between(parse(from), parse(to));
    }

    public static String addDays(String dateISO, long days) {
        return format(parse(dateISO).plusDays(days));
    }

    /**
     * Latest date on or before {@code dateISO} that falls on {@code weekStartDay}.
     */
    public static String startOfWeek(String dateISO, int weekStartDay) {
        return format(startOfWeek(parse(dateISO), weekStartDay));
    }

    static LocalDate startOfWeek(LocalDate date, int weekStartDay) {
        requireWeekday(weekStartDay);
        int offset = (dayOfWeek(date) - weekStartDay + 7) % 7;
        return date.minusDays(offset);
    }

    /**
     * Every date from {@code from} to {@code to}, both inclusive; empty when {@code from} is later.
     */
    public static List<String> dateRange(String from, String to) {
        List<String> dates = new ArrayList<>();
        LocalDate end = parse(to);
        for (LocalDate d = parse(from); !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(format(d));
        }
        return dates;
    }

    static void requireRolloverHour(int rolloverHour) {
        if (rolloverHour < 0 || rolloverHour > 23) {
            throw new IllegalArgumentException("rolloverHour must be within 0..23, got: " + rolloverHour);
        }
    }

    static void requireWeekday(int weekday) {
        if (weekday < 0 || weekday > 6) {
            throw new IllegalArgumentException("weekday must be within 0..6, got: " + weekday);
        }
    }
}
