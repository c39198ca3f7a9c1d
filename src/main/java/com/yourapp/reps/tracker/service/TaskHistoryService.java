package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.MonthlyTrend;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.model.TaskCompletion;
import com.yourapp.reps.tracker.model.YearSummary;
import com.yourapp.reps.tracker.repository.TaskCompletionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Completion history and the views built on it: per-day history, weekly rhythm, month over month
 * trend and a year summary.
 */
@Service
@Transactional(readOnly = true)
public class TaskHistoryService {
    private static final Logger logger = LoggerFactory.getLogger(TaskHistoryService.class);

    private final TaskCompletionRepository completionRepo;
    private final CalendarDays calendarDays;

    public TaskHistoryService(TaskCompletionRepository completionRepo, CalendarDays calendarDays) {
        this.completionRepo = completionRepo;
        this.calendarDays = calendarDays;
    }

    /**
     * All completions grouped by occurrence day, newest day first. Completions without a task
     * are left out.
     */
    public Map<LocalDate, List<TaskCompletion>> completionsByDay() {
        Map<LocalDate, List<TaskCompletion>> grouped = new LinkedHashMap<>();
        int skipped = 0;
        for (TaskCompletion completion : completionRepo.findAllWithTaskNewestFirst()) {
            if (completion.getTask() == null || completion.getOccurrenceDate() == null) {
                skipped++;
                continue;
            }
            grouped.computeIfAbsent(completion.getOccurrenceDate(), k -> new ArrayList<>()).add(completion);
        }
        if (skipped > 0) {
            logger.warn("Skipped {} completions without a task or day", skipped);
        }
        return grouped;
    }

    public List<TaskCompletion> completionsOn(LocalDate day) {
        List<TaskCompletion> result = new ArrayList<>();
        for (TaskCompletion completion : completionRepo.findByOccurrenceDate(day)) {
            if (completion.getTask() != null) {
                result.add(completion);
            }
        }
        return result;
    }

    /**
     * Completed occurrences per weekday, in local week order.
     */
    public Map<DayOfWeek, Integer> weeklyRhythm(Collection<Task> tasks) {
        Map<DayOfWeek, Integer> counts = new LinkedHashMap<>();
        for (DayOfWeek day : calendarDays.orderedWeek()) {
            counts.put(day, 0);
        }
        for (LocalDate day : occurrences(tasks)) {
            counts.merge(day.getDayOfWeek(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * This month's completed occurrences against last month's.
     */
    public MonthlyTrend monthlyTrend(Collection<Task> tasks) {
        YearMonth thisMonth = YearMonth.from(calendarDays.today());
        YearMonth lastMonth = thisMonth.minusMonths(1);

        int thisCount = 0;
        int lastCount = 0;
        for (LocalDate day : occurrences(tasks)) {
            YearMonth month = YearMonth.from(day);
            if (month.equals(thisMonth)) {
                thisCount++;
            } else if (month.equals(lastMonth)) {
                lastCount++;
            }
        }

        OptionalInt change = lastCount > 0
                ? OptionalInt.of((thisCount - lastCount) * 100 / lastCount)
                : OptionalInt.empty();
        return new MonthlyTrend(thisMonth, thisCount, lastCount, change);
    }

    public YearSummary yearSummary(Collection<Task> tasks, int year) {
        TreeMap<LocalDate, Integer> perDay = new TreeMap<>();
        for (LocalDate day : occurrences(tasks)) {
            if (day.getYear() == year) {
                perDay.merge(day, 1, Integer::sum);
            }
        }

        int total = perDay.values().stream().mapToInt(Integer::intValue).sum();
        int bestDay = perDay.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return new YearSummary(year, total, perDay.size(), bestDay,
                StreakCalculator.longestStreak(perDay.keySet()));
    }

    /**
     * One entry per (task, occurrence day); a day repeats once for every task done on it.
     */
    private List<LocalDate> occurrences(Collection<Task> tasks) {
        List<LocalDate> days = new ArrayList<>();
        if (tasks == null) {
            return days;
        }
        for (Task task : tasks) {
            days.addAll(CompletionLedger.of(task).occurrenceDays());
        }
        return days;
    }
}
