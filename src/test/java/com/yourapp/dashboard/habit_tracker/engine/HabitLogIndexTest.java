package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import com.yourapp.dashboard.habit_tracker.model.HabitValueType;
import com.yourapp.dashboard.habit_tracker.model.Recurrence;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HabitLogIndexTest {

    private final Habit habit = new Habit("habit-1", HabitValueType.BOOLEAN, Recurrence.weeklyTarget(3), "2024-01-01");

    private static HabitLog log(String date, boolean done, String timestamp) {
        HabitLog log = new HabitLog("habit-1", date, done, null);
        log.setTimestamp(timestamp);
        return log;
    }

    @Test
    void duplicate_dates_resolve_to_latest_timestamp_regardless_of_order() {
        HabitLog older = log("2024-01-05", true, "2024-01-05T08:00:00Z");
        HabitLog newer = log("2024-01-05", false, "2024-01-05T21:00:00Z");

        HabitLogIndex forward = HabitLogIndex.of(habit, List.of(older, newer));
        HabitLogIndex backward = HabitLogIndex.of(habit, List.of(newer, older));

        assertThat(forward.find(LocalDate.of(2024, 1, 5))).containsSame(newer);
        assertThat(backward.find(LocalDate.of(2024, 1, 5))).containsSame(newer);
    }

    @Test
    void duplicate_dates_without_timestamps_prefer_the_done_entry() {
        HabitLog missed = log("2024-01-05", false, null);
        HabitLog done = log("2024-01-05", true, null);

        assertThat(HabitLogIndex.of(habit, List.of(missed, done)).isCompleted(LocalDate.of(2024, 1, 5))).isTrue();
        assertThat(HabitLogIndex.of(habit, List.of(done, missed)).isCompleted(LocalDate.of(2024, 1, 5))).isTrue();
    }

    @Test
    void logs_of_other_habits_and_nulls_are_ignored() {
        HabitLog foreign = HabitLog.done("habit-2", "2024-01-05");

        HabitLogIndex index = HabitLogIndex.of(habit, Arrays.asList(foreign, null));

        assertThat(index.find(LocalDate.of(2024, 1, 5))).isEmpty();
        assertThat(index.countCompleted()).isZero();
    }

    @Test
    void null_log_collection_is_treated_as_empty() {
        assertThat(HabitLogIndex.of(habit, null).countCompleted()).isZero();
    }

    @Test
    void malformed_log_date_fails_fast() {
        assertThatThrownBy(() -> HabitLogIndex.of(habit, List.of(HabitLog.done("habit-1", "2024/01/05"))))
                .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void countCompleted_respects_inclusive_bounds() {
        HabitLogIndex index = HabitLogIndex.of(habit, List.of(
                HabitLog.done("habit-1", "2024-01-07"),
                HabitLog.done("habit-1", "2024-01-08"),
                HabitLog.done("habit-1", "2024-01-14"),
                HabitLog.done("habit-1", "2024-01-15")));

        assertThat(index.countCompleted(LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 14))).isEqualTo(2);
        assertThat(index.countCompleted()).isEqualTo(4);
    }
}
