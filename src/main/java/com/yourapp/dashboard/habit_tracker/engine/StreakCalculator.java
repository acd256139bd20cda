package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import com.yourapp.dashboard.habit_tracker.model.Recurrence;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Current and best streaks measured in consecutive due dates, not calendar days.
 * <p>
 * Dates on which the habit is not due are skipped entirely: a Monday-only habit keeps its
 * streak over the six days in between, but one missed Monday resets it. A due date that has
 * not been completed yet, today included, ends the current streak.
 */
public final class StreakCalculator {

    private StreakCalculator() {
    }

    public static StreakResult streak(Habit habit, Collection<HabitLog> logs, String todayISO) {
        Recurrence recurrence = RecurrenceEvaluator.recurrenceOf(habit);
        LocalDate createdAt = RecurrenceEvaluator.createdAtOf(habit);
        LocalDate today = CalendarDates.parse(todayISO);
        if (today.isBefore(createdAt)) {
            return StreakResult.NONE;
        }

        HabitLogIndex index = HabitLogIndex.of(habit, logs);
        int run = 0;
        int best = 0;
        for (LocalDate due : RecurrenceEvaluator.dueDates(recurrence, createdAt, createdAt, today)) {
            if (index.isCompleted(due)) {
                run++;
                best = Math.max(best, run);
            } else {
                run = 0;
            }
        }
        // the run still open at the last due date is the current streak
        return new StreakResult(run, best);
    }
}
