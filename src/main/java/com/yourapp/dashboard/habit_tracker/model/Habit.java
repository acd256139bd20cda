package com.yourapp.dashboard.habit_tracker.model;

public class Habit {

    private String id;
    private String title;
    private String description;
    private String emoji;
    private String color;

    private HabitValueType valueType = HabitValueType.BOOLEAN;
    private Double target;            // NUMERIC only, absent means 1
    private String unit;              // NUMERIC only, display

    private Recurrence recurrence;

    private String createdAt;         // yyyy-MM-dd, first day the habit can be due
    private Boolean archived = false;

    public Habit() {
    }

    public Habit(String id, HabitValueType valueType, Recurrence recurrence, String createdAt) {
        this.id = id;
        setValueType(valueType);
        this.recurrence = recurrence;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getEmoji() {
        return emoji;
    }

    public void setEmoji(String emoji) {
        this.emoji = emoji;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public HabitValueType getValueType() {
        return valueType != null ? valueType : HabitValueType.BOOLEAN;
    }

    public void setValueType(HabitValueType valueType) {
        this.valueType = valueType != null ? valueType : HabitValueType.BOOLEAN;
    }

    public Double getTarget() {
        return target;
    }

    public void setTarget(Double target) {
        this.target = target;
    }

    /**
     * Target a NUMERIC log value must reach, defaulting to 1 when none is set.
     */
    public double getEffectiveTarget() {
        return target != null ? target : 1.0;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Recurrence recurrence) {
        this.recurrence = recurrence;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public Boolean getArchived() {
        return archived != null ? archived : false;
    }

    public void setArchived(Boolean archived) {
        this.archived = archived != null ? archived : false;
    }

    @Override
    public String toString() {
        return "Habit{" +
                "id='" + id + '\'' +
                ", valueType=" + valueType +
                ", target=" + target +
                ", recurrence=" + recurrence +
                ", createdAt='" + createdAt + '\'' +
                ", archived=" + archived +
                '}';
    }
}
