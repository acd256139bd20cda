package com.yourapp.dashboard.habit_tracker.engine;

/**
 * Raised when a calendar-date string does not match {@code yyyy-MM-dd}
 * or names a day that does not exist.
 */
public class InvalidDateException extends IllegalArgumentException {

    private final String rawValue;

    public InvalidDateException(String rawValue, Throwable cause) {
        super("Invalid calendar date '" + rawValue + "', expected yyyy-MM-dd", cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
