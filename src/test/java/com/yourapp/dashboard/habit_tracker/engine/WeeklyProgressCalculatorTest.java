package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import com.yourapp.dashboard.habit_tracker.model.HabitValueType;
import com.yourapp.dashboard.habit_tracker.model.Recurrence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WeeklyProgressCalculatorTest {

    private static final String WEEK_START = "2024-01-08"; // Monday

    private static Habit habit(Recurrence recurrence, String createdAt) {
        return new Habit("habit-1", HabitValueType.BOOLEAN, recurrence, createdAt);
    }

    @Test
    void weekday_habit_targets_five_days() {
        Habit h = habit(Recurrence.specificDays(1, 2, 3, 4, 5), "2024-01-01");
        List<HabitLog> logs = List.of(
                HabitLog.done("habit-1", "2024-01-08"),
                HabitLog.done("habit-1", "2024-01-09"),
                HabitLog.done("habit-1", "2024-01-10"));

        assertThat(WeeklyProgressCalculator.weeklyProgress(h, logs, WEEK_START)).isEqualTo(new WeeklyProgress(3, 5));
    }

    @Test
    void weekly_target_uses_times_per_week() {
        Habit h = habit(Recurrence.weeklyTarget(3), "2024-01-01");
        List<HabitLog> logs = List.of(
                HabitLog.done("habit-1", "2024-01-08"),
                HabitLog.done("habit-1", "2024-01-10"));

        assertThat(WeeklyProgressCalculator.weeklyProgress(h, logs, WEEK_START)).isEqualTo(new WeeklyProgress(2, 3));
    }

    @Test
    void every_n_days_targets_due_dates_inside_the_week() {
        Habit h = habit(Recurrence.everyNDays(3), "2024-01-01"); // due 10th and 13th this week

        assertThat(WeeklyProgressCalculator.weeklyProgress(h, List.of(), WEEK_START).getTarget()).isEqualTo(2);
    }

    @Test
    void every_n_days_created_mid_week_only_counts_later_dates() {
        Habit h = habit(Recurrence.everyNDays(2), "2024-01-12"); // due 12th and 14th

        assertThat(WeeklyProgressCalculator.weeklyProgress(h, List.of(), WEEK_START).getTarget()).isEqualTo(2);
    }

    @Test
    void completed_logs_count_even_on_non_due_days() {
        Habit h = habit(Recurrence.specificDays(1), "2024-01-01");
        List<HabitLog> logs = List.of(
                HabitLog.done("habit-1", "2024-01-08"),
                HabitLog.done("habit-1", "2024-01-11"));

        assertThat(WeeklyProgressCalculator.weeklyProgress(h, logs, WEEK_START)).isEqualTo(new WeeklyProgress(2, 1));
    }

    @Test
    void logs_outside_the_week_or_not_completed_are_skipped() {
        Habit water = new Habit("habit-1", HabitValueType.NUMERIC, Recurrence.weeklyTarget(5), "2024-01-01");
        water.setTarget(8.0);
        List<HabitLog> logs = List.of(
                HabitLog.value("habit-1", "2024-01-07", 9),   // previous week
                HabitLog.value("habit-1", "2024-01-08", 8),
                HabitLog.value("habit-1", "2024-01-09", 3),   // below target
                HabitLog.value("habit-1", "2024-01-14", 12),
                HabitLog.value("habit-1", "2024-01-15", 8));  // next week

        assertThat(WeeklyProgressCalculator.weeklyProgress(water, logs, WEEK_START)).isEqualTo(new WeeklyProgress(2, 5));
    }

    @Test
    void week_spanning_new_year() {
        Habit h = habit(Recurrence.weeklyTarget(4), "2024-12-01");
        List<HabitLog> logs = List.of(
                HabitLog.done("habit-1", "2024-12-30"),
                HabitLog.done("habit-1", "2025-01-01"),
                HabitLog.done("habit-1", "2025-01-05"),
                HabitLog.done("habit-1", "2025-01-06"));

        assertThat(WeeklyProgressCalculator.weeklyProgress(h, logs, "2024-12-30")).isEqualTo(new WeeklyProgress(3, 4));
    }
}
