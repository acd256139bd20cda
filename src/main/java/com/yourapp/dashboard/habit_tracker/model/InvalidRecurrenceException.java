package com.yourapp.dashboard.habit_tracker.model;

/**
 * Thrown when a recurrence rule is built with parameters outside its domain.
 */
public class InvalidRecurrenceException extends IllegalArgumentException {

    public InvalidRecurrenceException(String message) {
        super(message);
    }
}
