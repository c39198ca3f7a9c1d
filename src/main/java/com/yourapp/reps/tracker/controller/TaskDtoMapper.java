package com.yourapp.reps.tracker.controller;

import com.yourapp.reps.tracker.controller.dto.CategoryDto;
import com.yourapp.reps.tracker.controller.dto.HistoryDayDto;
import com.yourapp.reps.tracker.controller.dto.MonthlyTrendDto;
import com.yourapp.reps.tracker.controller.dto.StatsSummaryDto;
import com.yourapp.reps.tracker.controller.dto.TaskRequestDto;
import com.yourapp.reps.tracker.controller.dto.TaskResponseDto;
import com.yourapp.reps.tracker.controller.dto.TaskStatsDto;
import com.yourapp.reps.tracker.controller.dto.WeekdayCountDto;
import com.yourapp.reps.tracker.model.Category;
import com.yourapp.reps.tracker.model.MonthlyTrend;
import com.yourapp.reps.tracker.model.RecurrenceRule;
import com.yourapp.reps.tracker.model.RecurrenceType;
import com.yourapp.reps.tracker.model.StatsSummary;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.model.TaskCompletion;
import com.yourapp.reps.tracker.model.TaskStats;
import com.yourapp.reps.tracker.service.CalendarDays;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Converts between API payloads and domain objects, including the 1-7 weekday numbering.
 */
@Component
@RequiredArgsConstructor
public class TaskDtoMapper {

    private final CalendarDays calendarDays;

    public RecurrenceRule toRule(TaskRequestDto request) {
        RecurrenceType type = request.recurrenceType() != null ? request.recurrenceType() : RecurrenceType.NONE;
        switch (type) {
            case DAILY:
                return RecurrenceRule.daily();
            case WEEKLY:
                List<DayOfWeek> weekdays = new ArrayList<>();
                if (request.weekdays() != null) {
                    for (Integer number : request.weekdays()) {
                        if (number == null) {
                            throw new IllegalArgumentException("Weekday number must not be null");
                        }
                        weekdays.add(calendarDays.dayOfWeek(number));
                    }
                }
                return RecurrenceRule.weekly(weekdays);
            case MONTHLY:
                if (request.monthDays() != null) {
                    for (Integer day : request.monthDays()) {
                        if (day == null || day < 1 || day > 31) {
                            throw new IllegalArgumentException("Day of month must be between 1 and 31: " + day);
                        }
                    }
                }
                return RecurrenceRule.monthly(request.monthDays());
            case NONE:
            default:
                return RecurrenceRule.none();
        }
    }

    public TaskResponseDto toDto(Task task, TaskStats stats) {
        RecurrenceRule rule = task.getRecurrenceRule();
        List<Integer> weekdays = rule.getWeekdays().stream()
                .map(calendarDays::weekdayNumber)
                .sorted()
                .collect(Collectors.toList());
        return new TaskResponseDto(
                task.getId(),
                task.getTitle(),
                task.getCategory(),
                rule.getType(),
                weekdays,
                new ArrayList<>(rule.getMonthDays()),
                task.getStartDate(),
                calendarDays.dayOf(task.getCreatedAt()),
                task.isActive(),
                task.getSortOrder(),
                toDto(stats));
    }

    public TaskStatsDto toDto(TaskStats stats) {
        return new TaskStatsDto(
                stats.isDueToday(),
                stats.isCompletedToday(),
                stats.getCurrentStreak(),
                stats.getBestStreak(),
                stats.getBestScheduledStreak(),
                boxed(stats.getCompletionRate()),
                stats.getTotalCompletions());
    }

    public StatsSummaryDto toDto(String scope, StatsSummary summary) {
        return new StatsSummaryDto(
                scope,
                summary.getTaskCount(),
                summary.getDueToday(),
                summary.getCompletedToday(),
                summary.getTotalCompletions(),
                summary.getCurrentStreak(),
                summary.getBestStreak(),
                boxed(summary.getCompletionRate()));
    }

    public List<HistoryDayDto> toHistory(Map<LocalDate, List<TaskCompletion>> byDay) {
        List<HistoryDayDto> days = new ArrayList<>();
        byDay.forEach((day, completions) -> days.add(new HistoryDayDto(day, completions.stream()
                .map(c -> new HistoryDayDto.Entry(
                        c.getId(),
                        c.getTask().getId(),
                        c.getTask().getTitle(),
                        c.getTask().getCategory(),
                        c.getCompletedAt()))
                .collect(Collectors.toList()))));
        return days;
    }

    public List<WeekdayCountDto> toRhythm(Map<DayOfWeek, Integer> counts) {
        List<WeekdayCountDto> rhythm = new ArrayList<>();
        counts.forEach((day, count) -> rhythm.add(new WeekdayCountDto(calendarDays.weekdayNumber(day), day, count)));
        return rhythm;
    }

    public MonthlyTrendDto toDto(MonthlyTrend trend) {
        return new MonthlyTrendDto(
                trend.getMonth().toString(),
                trend.getThisMonthCount(),
                trend.getLastMonthCount(),
                boxed(trend.getChangePercent()),
                trend.isPositive());
    }

    public CategoryDto toDto(Category category) {
        return new CategoryDto(category.getId(), category.getName(), category.getIconName(),
                category.getColorHex(), category.getSortOrder());
    }

    private static Integer boxed(OptionalInt value) {
        return value.isPresent() ? value.getAsInt() : null;
    }
}
