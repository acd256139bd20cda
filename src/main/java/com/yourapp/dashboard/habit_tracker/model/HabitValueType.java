package com.yourapp.dashboard.habit_tracker.model;

/**
 * How a habit's log entries are judged complete.
 */
public enum HabitValueType {
    /**
     * Done or not done
     */
    BOOLEAN,

    /**
     * A logged quantity compared against the habit's target
     */
    NUMERIC
}
