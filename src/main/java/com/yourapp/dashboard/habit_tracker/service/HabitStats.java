package com.yourapp.dashboard.habit_tracker.service;

import com.yourapp.dashboard.habit_tracker.engine.WeeklyProgress;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the habit list shows for one habit, derived from a single snapshot.
 */
@Value
@Builder
public class HabitStats {
    String habitId;
    String todayISO;
    boolean dueToday;
    boolean completedToday;
    int currentStreak;
    int bestStreak;
    long totalCompletions;
    int score;
    WeeklyProgress weeklyProgress;
}
