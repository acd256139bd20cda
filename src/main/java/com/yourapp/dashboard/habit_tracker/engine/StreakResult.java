package com.yourapp.dashboard.habit_tracker.engine;

import lombok.Value;

@Value
public class StreakResult {
    public static final StreakResult NONE = new StreakResult(0, 0);

    int current;
    int best;
}
