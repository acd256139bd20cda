package com.yourapp.dashboard.habit_tracker.engine;

import lombok.Value;

/**
 * Completed entries versus the expected count for one seven-day window.
 */
@Value
public class WeeklyProgress {
    int completed;
    int target;
}
