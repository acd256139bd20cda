package com.yourapp.dashboard.habit_tracker.engine;

import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Date-keyed view over one habit's logs. The result does not depend on the order of the input.
 */
public final class HabitLogIndex {
    private static final Logger logger = LoggerFactory.getLogger(HabitLogIndex.class);

    // later timestamp wins, then a done entry, then the larger value
    private static final Comparator<HabitLog> PREFERENCE = Comparator
            .comparing(HabitLog::getTimestamp, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(HabitLog::getDone)
            .thenComparing(HabitLog::getValue, Comparator.nullsFirst(Comparator.<Double>naturalOrder()));

    private final Habit habit;
    private final Map<LocalDate, HabitLog> byDate;

    private HabitLogIndex(Habit habit, Map<LocalDate, HabitLog> byDate) {
        this.habit = habit;
        this.byDate = byDate;
    }

    public static HabitLogIndex of(Habit habit, Collection<HabitLog> logs) {
        if (habit == null) {
            throw new IllegalArgumentException("habit must not be null");
        }
        Map<LocalDate, HabitLog> byDate = new HashMap<>();
        if (logs == null) {
            return new HabitLogIndex(habit, byDate);
        }
        for (HabitLog log : logs) {
            if (log == null) {
                continue;
            }
            if (habit.getId() != null && log.getHabitId() != null && !habit.getId().equals(log.getHabitId())) {
                logger.debug("Ignoring log of habit {} passed for habit {}", log.getHabitId(), habit.getId());
                continue;
            }
            LocalDate date = CalendarDates.parse(log.getDateISO());
            HabitLog existing = byDate.get(date);
            if (existing == null) {
                byDate.put(date, log);
            } else {
                logger.debug("Duplicate logs for habit {} on {}", habit.getId(), date);
                if (PREFERENCE.compare(log, existing) > 0) {
                    byDate.put(date, log);
                }
            }
        }
        return new HabitLogIndex(habit, byDate);
    }

    public Optional<HabitLog> find(LocalDate date) {
        return Optional.ofNullable(byDate.get(date));
    }

    public boolean isCompleted(LocalDate date) {
        return CompletionEvaluator.isCompleted(habit, find(date));
    }

    public long countCompleted(LocalDate from, LocalDate to) {
        return byDate.entrySet().stream()
                .filter(e -> !e.getKey().isBefore(from) && !e.getKey().isAfter(to))
                .map(Map.Entry::getValue)
                .filter(log -> CompletionEvaluator.isCompleted(habit, Optional.of(log)))
                .count();
    }

    public long countCompleted() {
        return byDate.values().stream()
                .filter(log -> CompletionEvaluator.isCompleted(habit, Optional.of(log)))
                .count();
    }
}
