package com.yourapp.dashboard.habit_tracker.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Defines the recurrence pattern for habits.
 * <p>
 * Exactly one of the three kinds is active; the fields of the other kinds are unused.
 * Instances are immutable and validated on construction.
 */
public final class Recurrence {

    public enum Kind {
        /**
         * Due on a fixed set of weekdays (0 = Sunday .. 6 = Saturday)
         */
        SPECIFIC_DAYS,

        /**
         * Due every day; the goal is a number of completions per week
         */
        WEEKLY_TARGET,

        /**
         * Due every N days counted from the habit's creation date
         */
        EVERY_N_DAYS
    }

    private final Kind kind;
    private final Set<Integer> days;
    private final int timesPerWeek;
    private final int interval;

    private Recurrence(Kind kind, Set<Integer> days, int timesPerWeek, int interval) {
        this.kind = kind;
        this.days = days;
        this.timesPerWeek = timesPerWeek;
        this.interval = interval;
    }

    public static Recurrence specificDays(Collection<Integer> days) {
        if (days == null) {
            throw new InvalidRecurrenceException("days must not be null");
        }
        Set<Integer> sorted = new TreeSet<>();
        for (Integer day : days) {
            if (day == null || day < 0 || day > 6) {
                throw new InvalidRecurrenceException("day of week must be within 0..6, got: " + day);
            }
            sorted.add(day);
        }
        return new Recurrence(Kind.SPECIFIC_DAYS, Collections.unmodifiableSet(sorted), 0, 0);
    }

    public static Recurrence specificDays(Integer... days) {
        return specificDays(days == null ? null : Arrays.asList(days));
    }

    public static Recurrence weeklyTarget(int timesPerWeek) {
        if (timesPerWeek < 0) {
            throw new InvalidRecurrenceException("timesPerWeek must be >= 0, got: " + timesPerWeek);
        }
        return new Recurrence(Kind.WEEKLY_TARGET, Collections.emptySet(), timesPerWeek, 0);
    }

    public static Recurrence everyNDays(int interval) {
        if (interval < 1) {
            throw new InvalidRecurrenceException("interval must be >= 1, got: " + interval);
        }
        return new Recurrence(Kind.EVERY_N_DAYS, Collections.emptySet(), 0, interval);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Configured weekdays, ascending. Empty unless {@link Kind#SPECIFIC_DAYS}.
     */
    public Set<Integer> getDays() {
        return days;
    }

    public int getTimesPerWeek() {
        return timesPerWeek;
    }

    public int getInterval() {
        return interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recurrence)) return false;
        Recurrence that = (Recurrence) o;
        return timesPerWeek == that.timesPerWeek
                && interval == that.interval
                && kind == that.kind
                && days.equals(that.days);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, days, timesPerWeek, interval);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SPECIFIC_DAYS -> "Recurrence{SPECIFIC_DAYS, days=" + days + '}';
            case WEEKLY_TARGET -> "Recurrence{WEEKLY_TARGET, timesPerWeek=" + timesPerWeek + '}';
            case EVERY_N_DAYS -> "Recurrence{EVERY_N_DAYS, interval=" + interval + '}';
        };
    }
}
