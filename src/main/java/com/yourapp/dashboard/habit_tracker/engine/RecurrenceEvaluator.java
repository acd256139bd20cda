package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.Recurrence;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether a habit is due on a calendar date. {@link #isDue} is constant time and
 * never looks at logs.
 */
public final class RecurrenceEvaluator {

    private RecurrenceEvaluator() {
    }

    public static boolean isDue(Habit habit, String dateISO) {
        LocalDate date = CalendarDates.parse(dateISO);
        return isDue(recurrenceOf(habit), createdAtOf(habit), date);
    }

    static boolean isDue(Recurrence recurrence, LocalDate createdAt, LocalDate date) {
        if (date.isBefore(createdAt)) {
            return false;
        }
        return switch (recurrence.getKind()) {
            case SPECIFIC_DAYS -> recurrence.getDays().contains(CalendarDates.dayOfWeek(date));
            case WEEKLY_TARGET -> true;
            case EVERY_N_DAYS -> ChronoUnit.DAYS.between(createdAt, date) % recurrence.getInterval() == 0;
        };
    }

    /**
     * Due dates of the habit between {@code fromISO} and {@code toISO}, both inclusive, ascending.
     */
    public static List<String> dueDates(Habit habit, String fromISO, String toISO) {
        LocalDate from = CalendarDates.parse(fromISO);
        LocalDate to = CalendarDates.parse(toISO);
        return dueDates(recurrenceOf(habit), createdAtOf(habit), from, to).stream()
                .map(CalendarDates::format)
                .collect(Collectors.toList());
    }

    static List<LocalDate> dueDates(Recurrence recurrence, LocalDate createdAt, LocalDate from, LocalDate to) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate start = from.isBefore(createdAt) ? createdAt : from;
        if (recurrence.getKind() == Recurrence.Kind.EVERY_N_DAYS) {
            // jump straight to the first multiple of the interval on or after start
            long offset = ChronoUnit.DAYS.between(createdAt, start);
            long remainder = offset % recurrence.getInterval();
            LocalDate d = remainder == 0 ? start : start.plusDays(recurrence.getInterval() - remainder);
            for (; !d.isAfter(to); d = d.plusDays(recurrence.getInterval())) {
                dates.add(d);
            }
            return dates;
        }
        for (LocalDate d = start; !d.isAfter(to); d = d.plusDays(1)) {
            if (isDue(recurrence, createdAt, d)) {
                dates.add(d);
            }
        }
        return dates;
    }

    static Recurrence recurrenceOf(Habit habit) {
        requireHabit(habit);
        if (habit.getRecurrence() == null) {
            throw new IllegalArgumentException("Habit " + habit.getId() + " has no recurrence");
        }
        return habit.getRecurrence();
    }

    static LocalDate createdAtOf(Habit habit) {
        requireHabit(habit);
        if (habit.getCreatedAt() == null) {
            throw new IllegalArgumentException("Habit " + habit.getId() + " has no createdAt date");
        }
        return CalendarDates.parse(habit.getCreatedAt());
    }

    private static void requireHabit(Habit habit) {
        if (habit == null) {
            throw new IllegalArgumentException("habit must not be null");
        }
    }
}
