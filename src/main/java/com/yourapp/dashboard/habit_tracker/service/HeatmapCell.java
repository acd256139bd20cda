package com.yourapp.dashboard.habit_tracker.service;

import lombok.Value;

@Value
public class HeatmapCell {
    String dateISO;
    boolean due;
    boolean completed;
    double value;   // logged amount for NUMERIC habits, 1/0 for BOOLEAN
}
