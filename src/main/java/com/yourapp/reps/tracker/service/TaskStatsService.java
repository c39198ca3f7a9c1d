package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.RecurrenceRule;
import com.yourapp.reps.tracker.model.RecurrenceType;
import com.yourapp.reps.tracker.model.StatsSummary;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.model.TaskStats;
import com.yourapp.reps.tracker.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Answers the questions the rest of the app asks about tasks: is it due today, is it done today,
 * what are its streaks and its completion rate, and the same rolled up over many tasks.
 *
 * <p>Nothing here throws for odd data. A missing task, creation date or rule selection falls back
 * to "not due", a zero streak or no rate.
 */
@Service
@Transactional(readOnly = true)
public class TaskStatsService {
    private static final Logger logger = LoggerFactory.getLogger(TaskStatsService.class);

    private final CalendarDays calendarDays;
    private final TaskRepository taskRepo;

    public TaskStatsService(CalendarDays calendarDays, TaskRepository taskRepo) {
        this.calendarDays = calendarDays;
        this.taskRepo = taskRepo;
    }

    public boolean isDueToday(Task task) {
        return isDueOn(task, calendarDays.today());
    }

    /**
     * Active, scheduled on {@code day} by its rule, and for one-time tasks never completed.
     */
    public boolean isDueOn(Task task, LocalDate day) {
        if (task == null || !task.isActive()) {
            return false;
        }
        LocalDate createdOn = createdOn(task);
        if (createdOn == null) {
            logger.warn("Task {} has no creation date, treating it as not due", task.getId());
            return false;
        }
        RecurrenceRule rule = task.getRecurrenceRule();
        if (rule.isEmptySelection()) {
            logger.debug("Task {} has an empty {} selection and is never due", task.getId(), rule.getType());
            return false;
        }
        if (!rule.isDue(day, createdOn, task.getStartDate())) {
            return false;
        }
        if (rule.getType() == RecurrenceType.NONE) {
            return !CompletionLedger.of(task).hasAnyCompletion();
        }
        return true;
    }

    public boolean isCompletedToday(Task task) {
        return CompletionLedger.of(task).isCompletedOn(calendarDays.today());
    }

    public int currentStreak(Task task) {
        return StreakCalculator.currentStreak(CompletionLedger.of(task).occurrenceDays(), calendarDays.today());
    }

    public int bestStreak(Task task) {
        return StreakCalculator.longestStreak(CompletionLedger.of(task).occurrenceDays());
    }

    /**
     * Longest run of consecutive scheduled occurrences completed, so three Mondays in a row count
     * as 3 for a Monday-only task. One-time tasks use the calendar-day streak.
     */
    public int bestScheduledStreak(Task task) {
        if (task == null) {
            return 0;
        }
        RecurrenceRule rule = task.getRecurrenceRule();
        LocalDate createdOn = createdOn(task);
        if (!rule.isRecurring() || createdOn == null) {
            return bestStreak(task);
        }
        List<LocalDate> scheduled = ScheduleAccounting.scheduledDays(
                rule, createdOn, calendarDays.today(), task.getStartDate());
        return StreakCalculator.longestScheduledRun(CompletionLedger.of(task).occurrenceDays(), scheduled);
    }

    /**
     * Completed share of scheduled occurrences since the task was created, as a whole
     * percentage rounded down and capped at 100. Empty for one-time tasks and for rules that
     * select no days.
     */
    public OptionalInt completionRate(Task task) {
        long[] parts = rateParts(task);
        if (parts == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(percentage(parts[0], parts[1]));
    }

    public TaskStats statsFor(Task task) {
        return new TaskStats(
                isDueToday(task),
                isCompletedToday(task),
                currentStreak(task),
                bestStreak(task),
                bestScheduledStreak(task),
                completionRate(task),
                CompletionLedger.of(task).size());
    }

    /**
     * Rolls the statistics of {@code tasks} together. A day counts once toward the shared streak
     * if any member was completed on it.
     */
    public StatsSummary summarize(Collection<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return StatsSummary.empty();
        }
        LocalDate today = calendarDays.today();

        Set<LocalDate> unionDays = new TreeSet<>();
        int taskCount = 0;
        int dueToday = 0;
        int completedToday = 0;
        int totalCompletions = 0;
        long completedSum = 0;
        long scheduledSum = 0;
        boolean anyRate = false;

        for (Task task : tasks) {
            if (task == null) {
                continue;
            }
            taskCount++;
            CompletionLedger ledger = CompletionLedger.of(task);
            Set<LocalDate> days = ledger.occurrenceDays();
            unionDays.addAll(days);
            totalCompletions += days.size();
            if (isDueOn(task, today)) {
                dueToday++;
            }
            // archived tasks keep their history but drop out of today's figures
            if (task.isActive() && ledger.isCompletedOn(today)) {
                completedToday++;
            }
            long[] parts = rateParts(task);
            if (parts != null) {
                anyRate = true;
                completedSum += parts[0];
                scheduledSum += parts[1];
            }
        }

        OptionalInt rate = anyRate ? OptionalInt.of(percentage(completedSum, scheduledSum)) : OptionalInt.empty();
        return new StatsSummary(taskCount, dueToday, completedToday, totalCompletions,
                StreakCalculator.currentStreak(unionDays, today),
                StreakCalculator.longestStreak(unionDays),
                rate);
    }

    public StatsSummary summarizeCategory(String category) {
        return summarize(taskRepo.findByCategoryOrderBySortOrderAsc(category));
    }

    public StatsSummary summarizeAll() {
        return summarize(taskRepo.findAll());
    }

    /**
     * {completed, scheduled} for a recurring task, or null when no rate applies.
     */
    private long[] rateParts(Task task) {
        if (task == null) {
            return null;
        }
        RecurrenceRule rule = task.getRecurrenceRule();
        LocalDate createdOn = createdOn(task);
        if (!rule.isRecurring() || rule.isEmptySelection() || createdOn == null) {
            return null;
        }
        LocalDate today = calendarDays.today();

        // startDate only shifts the lifetime of DAILY rules
        LocalDate lifetimeStart = rule.getType() == RecurrenceType.DAILY
                ? RecurrenceRule.effectiveStart(createdOn, task.getStartDate())
                : createdOn;
        long completed = CompletionLedger.of(task).occurrenceDays(lifetimeStart, today).size();
        long scheduled = ScheduleAccounting.scheduledDayCount(rule, createdOn, today, task.getStartDate());
        return new long[]{completed, scheduled};
    }

    private static int percentage(long completed, long scheduled) {
        if (scheduled <= 0) {
            return 0;
        }
        return (int) Math.min(100, completed * 100 / scheduled);
    }

    private LocalDate createdOn(Task task) {
        return calendarDays.dayOf(task.getCreatedAt());
    }
}
