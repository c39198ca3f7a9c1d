package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.model.TaskCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Completion records of a single task, keyed by occurrence day.
 *
 * <p>{@link #toggle(LocalDate, LocalDateTime)} is the only way to complete or un-complete an
 * occurrence. It works on the task's own completion list; persisting the task afterwards is
 * up to the caller.
 */
public class CompletionLedger {
    private static final Logger logger = LoggerFactory.getLogger(CompletionLedger.class);

    private final Task task;

    private CompletionLedger(Task task) {
        this.task = task;
    }

    public static CompletionLedger of(Task task) {
        return new CompletionLedger(task);
    }

    /**
     * Distinct days with at least one completion, ascending.
     */
    public NavigableSet<LocalDate> occurrenceDays() {
        NavigableSet<LocalDate> days = new TreeSet<>();
        if (task == null) {
            return days;
        }
        for (TaskCompletion completion : task.getCompletions()) {
            LocalDate day = completion != null ? completion.getOccurrenceDate() : null;
            if (day != null) {
                days.add(day);
            }
        }
        return days;
    }

    /**
     * Occurrence days within {@code [from, through]}, both inclusive.
     */
    public NavigableSet<LocalDate> occurrenceDays(LocalDate from, LocalDate through) {
        NavigableSet<LocalDate> days = occurrenceDays();
        if (from == null || through == null || through.isBefore(from)) {
            return new TreeSet<>();
        }
        return new TreeSet<>(days.subSet(from, true, through, true));
    }

    public boolean isCompletedOn(LocalDate day) {
        if (task == null || day == null) {
            return false;
        }
        return task.getCompletions().stream()
                .anyMatch(c -> c != null && day.equals(c.getOccurrenceDate()));
    }

    public boolean hasAnyCompletion() {
        return !occurrenceDays().isEmpty();
    }

    public int size() {
        return occurrenceDays().size();
    }

    /**
     * Flips the completion state of {@code day}: removes the day's record if there is one,
     * otherwise adds a record stamped {@code now}.
     *
     * @return true if the day is completed afterwards
     */
    public boolean toggle(LocalDate day, LocalDateTime now) {
        Objects.requireNonNull(task, "Ledger has no task");
        Objects.requireNonNull(day, "Day must not be null");

        List<TaskCompletion> sameDay = new ArrayList<>();
        for (TaskCompletion completion : task.getCompletions()) {
            if (completion != null && day.equals(completion.getOccurrenceDate())) {
                sameDay.add(completion);
            }
        }

        if (!sameDay.isEmpty()) {
            if (sameDay.size() > 1) {
                logger.warn("Task {} had {} completions on {}, removing all of them",
                        task.getId(), sameDay.size(), day);
            }
            for (TaskCompletion completion : sameDay) {
                task.removeCompletion(completion);
            }
            return false;
        }

        task.addCompletion(new TaskCompletion(task, now, day));
        return true;
    }
}
