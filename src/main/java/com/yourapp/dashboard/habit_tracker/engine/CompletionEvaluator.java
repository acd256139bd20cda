package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;

import java.util.Optional;

/**
 * Decides whether a log entry completes its habit.
 * A missing log is passed as {@link Optional#empty()} and never counts.
 */
public final class CompletionEvaluator {

    private CompletionEvaluator() {
    }

    public static boolean isCompleted(Habit habit, Optional<HabitLog> log) {
        if (habit == null) {
            throw new IllegalArgumentException("habit must not be null");
        }
        if (log == null || log.isEmpty()) {
            return false;
        }
        HabitLog entry = log.get();
        return switch (habit.getValueType()) {
            case BOOLEAN -> Boolean.TRUE.equals(entry.getDone());
            // no upper clamp, overshooting the target still completes
            case NUMERIC -> entry.getValue() != null && entry.getValue() >= habit.getEffectiveTarget();
        };
    }
}
