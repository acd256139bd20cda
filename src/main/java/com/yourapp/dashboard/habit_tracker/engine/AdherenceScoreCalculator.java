package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import com.yourapp.dashboard.habit_tracker.model.Recurrence;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;

/**
 * Recency-weighted share of due dates completed within a trailing window, as 0..100.
 */
public final class AdherenceScoreCalculator {

    public static final int DEFAULT_WINDOW_DAYS = 30;

    /**
     * Per-day decay of a due date's weight; yesterday weighs e^-0.05 of today.
     */
    static final double DECAY_PER_DAY = 0.05;

    private AdherenceScoreCalculator() {
    }

    /**
     * Scores the window {@code [today - windowDays + 1, today]}.
     *
     * @return 100 when nothing was due in the window, 0 when nothing due was completed
     */
    public static int score(Habit habit, Collection<HabitLog> logs, String todayISO, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1, got: " + windowDays);
        }
        Recurrence recurrence = RecurrenceEvaluator.recurrenceOf(habit);
        LocalDate createdAt = RecurrenceEvaluator.createdAtOf(habit);
        LocalDate today = CalendarDates.parse(todayISO);
        LocalDate windowStart = today.minusDays(windowDays - 1L);

        List<LocalDate> due = RecurrenceEvaluator.dueDates(recurrence, createdAt, windowStart, today);
        if (due.isEmpty()) {
            return 100;
        }

        HabitLogIndex index = HabitLogIndex.of(habit, logs);
        // due dates are ascending, so the last one is the newest and carries the largest weight
        double newest = logWeight(ChronoUnit.DAYS.between(due.get(due.size() - 1), today));
        double totalWeight = 0;
        double completedWeight = 0;
        boolean anyCompleted = false;
        for (LocalDate date : due) {
            double weight = Math.exp(logWeight(ChronoUnit.DAYS.between(date, today)) - newest);
            totalWeight += weight;
            if (index.isCompleted(date)) {
                completedWeight += weight;
                anyCompleted = true;
            }
        }
        if (!anyCompleted) {
            return 0;
        }
        return (int) Math.round(100.0 * completedWeight / totalWeight);
    }

    /**
     * Natural log of a due date's weight. Kept in log form so that no age underflows to zero.
     */
    static double logWeight(long daysBeforeToday) {
        return -DECAY_PER_DAY * daysBeforeToday;
    }
}
