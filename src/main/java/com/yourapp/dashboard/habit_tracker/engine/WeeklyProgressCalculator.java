package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import com.yourapp.dashboard.habit_tracker.model.Recurrence;

import java.time.LocalDate;
import java.util.Collection;

public final class WeeklyProgressCalculator {

    private WeeklyProgressCalculator() {
    }

    /**
     * Progress over {@code [weekStart, weekStart + 6]}. Every completed log in the window counts,
     * whether or not its date was due.
     */
    public static WeeklyProgress weeklyProgress(Habit habit, Collection<HabitLog> logs, String weekStartISO) {
        Recurrence recurrence = RecurrenceEvaluator.recurrenceOf(habit);
        LocalDate createdAt = RecurrenceEvaluator.createdAtOf(habit);
        LocalDate weekStart = CalendarDates.parse(weekStartISO);
        LocalDate weekEnd = weekStart.plusDays(6);

        int completed = (int) HabitLogIndex.of(habit, logs).countCompleted(weekStart, weekEnd);
        int target = switch (recurrence.getKind()) {
            case SPECIFIC_DAYS -> recurrence.getDays().size();
            case WEEKLY_TARGET -> recurrence.getTimesPerWeek();
            case EVERY_N_DAYS -> RecurrenceEvaluator.dueDates(recurrence, createdAt, weekStart, weekEnd).size();
        };
        return new WeeklyProgress(completed, target);
    }
}
