package com.yourapp.dashboard.habit_tracker.model;

/**
 * One progress entry for a habit on one effective calendar date.
 * At most one log exists per (habitId, dateISO); callers keep that invariant.
 */
public class HabitLog {

    private String habitId;
    private String dateISO;           // effective date, already rollover-adjusted
    private Boolean done = false;     // BOOLEAN habits
    private Double value;             // NUMERIC habits
    private String timestamp;         // informational

    public HabitLog() {
    }

    public HabitLog(String habitId, String dateISO, Boolean done, Double value) {
        this.habitId = habitId;
        this.dateISO = dateISO;
        setDone(done);
        this.value = value;
    }

    public static HabitLog done(String habitId, String dateISO) {
        return new HabitLog(habitId, dateISO, true, null);
    }

    public static HabitLog value(String habitId, String dateISO, double value) {
        return new HabitLog(habitId, dateISO, true, value);
    }

    public String getHabitId() {
        return habitId;
    }

    public void setHabitId(String habitId) {
        this.habitId = habitId;
    }

    public String getDateISO() {
        return dateISO;
    }

    public void setDateISO(String dateISO) {
        this.dateISO = dateISO;
    }

    public Boolean getDone() {
        return done != null ? done : false;
    }

    public void setDone(Boolean done) {
        this.done = done != null ? done : false;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "HabitLog{" +
                "habitId='" + habitId + '\'' +
                ", dateISO='" + dateISO + '\'' +
                ", done=" + done +
                ", value=" + value +
                ", timestamp='" + timestamp + '\'' +
                '}';
    }
}
