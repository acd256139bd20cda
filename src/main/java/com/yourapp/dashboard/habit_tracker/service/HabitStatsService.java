package com.yourapp.dashboard.habit_tracker.service;

import com.yourapp.dashboard.habit_tracker.config.HabitSettings;
import com.yourapp.dashboard.habit_tracker.engine.AdherenceScoreCalculator;
import com.yourapp.dashboard.habit_tracker.engine.CalendarDates;
import com.yourapp.dashboard.habit_tracker.engine.HabitLogIndex;
import com.yourapp.dashboard.habit_tracker.engine.RecurrenceEvaluator;
import com.yourapp.dashboard.habit_tracker.engine.StreakCalculator;
import com.yourapp.dashboard.habit_tracker.engine.StreakResult;
import com.yourapp.dashboard.habit_tracker.engine.WeeklyProgress;
import com.yourapp.dashboard.habit_tracker.engine.WeeklyProgressCalculator;
import com.yourapp.dashboard.habit_tracker.model.Habit;
import com.yourapp.dashboard.habit_tracker.model.HabitLog;
import com.yourapp.dashboard.habit_tracker.model.HabitValueType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only facade the query layer calls with a freshly loaded snapshot of a habit and its logs.
 * Resolves "today" from the clock and the configured rollover hour, then derives every figure
 * from scratch; nothing is cached or written back.
 */
@Service
@RequiredArgsConstructor
public class HabitStatsService {
    private static final Logger logger = LoggerFactory.getLogger(HabitStatsService.class);

    private final Clock clock;
    private final HabitSettings settings;

    public String today() {
        return CalendarDates.effectiveDate(LocalDateTime.now(clock), settings.getRolloverHour());
    }

    public String currentWeekStart() {
        return CalendarDates.startOfWeek(today(), settings.getWeekStartDay());
    }

    public HabitStats statsFor(Habit habit, Collection<HabitLog> logs) {
        String today = today();
        return statsFor(habit, logs, today, CalendarDates.startOfWeek(today, settings.getWeekStartDay()));
    }

    private HabitStats statsFor(Habit habit, Collection<HabitLog> logs, String today, String weekStart) {
        HabitLogIndex index = HabitLogIndex.of(habit, logs);
        StreakResult streak = StreakCalculator.streak(habit, logs, today);
        int score = AdherenceScoreCalculator.score(habit, logs, today, settings.getScoreWindowDays());
        WeeklyProgress weekly = WeeklyProgressCalculator.weeklyProgress(habit, logs, weekStart);

        HabitStats stats = HabitStats.builder()
                .habitId(habit.getId())
                .todayISO(today)
                .dueToday(RecurrenceEvaluator.isDue(habit, today))
                .completedToday(index.isCompleted(CalendarDates.parse(today)))
                .currentStreak(streak.getCurrent())
                .bestStreak(streak.getBest())
                .totalCompletions(index.countCompleted())
                .score(score)
                .weeklyProgress(weekly)
                .build();
        logger.debug("Stats for habit {} on {}: {}", habit.getId(), today, stats);
        return stats;
    }

    /**
     * Stats for every non-archived habit, in the order given. Habits without an entry in
     * {@code logsByHabitId} are treated as never logged.
     */
    public List<HabitStats> todayOverview(List<Habit> habits, Map<String, ? extends Collection<HabitLog>> logsByHabitId) {
        String today = today();
        String weekStart = CalendarDates.startOfWeek(today, settings.getWeekStartDay());
        List<HabitStats> overview = new ArrayList<>();
        for (Habit habit : habits) {
            if (habit.getArchived()) {
                continue;
            }
            Collection<HabitLog> logs = logsByHabitId != null ? logsByHabitId.get(habit.getId()) : null;
            overview.add(statsFor(habit, logs != null ? logs : Collections.emptyList(), today, weekStart));
        }
        logger.debug("Built overview for {} of {} habits on {}", overview.size(), habits.size(), today);
        return overview;
    }

    /**
     * One cell per date in {@code [fromISO, toISO]}, for calendar heatmaps.
     */
    public List<HeatmapCell> heatmap(Habit habit, Collection<HabitLog> logs, String fromISO, String toISO) {
        HabitLogIndex index = HabitLogIndex.of(habit, logs);
        List<HeatmapCell> cells = new ArrayList<>();
        for (String dateISO : CalendarDates.dateRange(fromISO, toISO)) {
            LocalDate date = CalendarDates.parse(dateISO);
            Optional<HabitLog> log = index.find(date);
            boolean completed = index.isCompleted(date);
            double value;
            if (habit.getValueType() == HabitValueType.NUMERIC) {
                value = log.map(HabitLog::getValue).orElse(0.0);
            } else {
                value = completed ? 1 : 0;
            }
            cells.add(new HeatmapCell(dateISO, RecurrenceEvaluator.isDue(habit, dateISO), completed, value));
        }
        return cells;
    }
}
