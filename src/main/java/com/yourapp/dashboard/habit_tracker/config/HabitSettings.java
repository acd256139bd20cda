package com.yourapp.dashboard.habit_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * User-level settings the habit engine consumes. They are handed to every engine call
 * as plain arguments; the engine itself never reads this bean.
 */
@Component
@ConfigurationProperties(prefix = "habits")
public class HabitSettings {
    private int rolloverHour = 4;       // a "day" runs from 04:00 to 03:59
    private int weekStartDay = 1;       // 0 = Sunday, 1 = Monday
    private int scoreWindowDays = 30;

    @PostConstruct
    public void init() {
        if (rolloverHour < 0 || rolloverHour > 23) {
            throw new IllegalStateException("habits.rollover-hour must be within 0..23, got: " + rolloverHour);
        }
        if (weekStartDay < 0 || weekStartDay > 6) {
            throw new IllegalStateException("habits.week-start-day must be within 0..6, got: " + weekStartDay);
        }
        if (scoreWindowDays < 1) {
            throw new IllegalStateException("habits.score-window-days must be >= 1, got: " + scoreWindowDays);
        }
    }

    // Getters and setters for configuration
    public int getRolloverHour() { return rolloverHour; }
    public void setRolloverHour(int rolloverHour) { this.rolloverHour = rolloverHour; }
    public int getWeekStartDay() { return weekStartDay; }
    public void setWeekStartDay(int weekStartDay) { this.weekStartDay = weekStartDay; }
    public int getScoreWindowDays() { return scoreWindowDays; }
    public void setScoreWindowDays(int scoreWindowDays) { this.scoreWindowDays = scoreWindowDays; }
}
