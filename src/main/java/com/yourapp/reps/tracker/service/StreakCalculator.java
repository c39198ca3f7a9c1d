package com.yourapp.reps.tracker.service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Streaks over any set of completed days: one task's occurrence days, or the union across a
 * category or all tasks.
 */
public final class StreakCalculator {

    private StreakCalculator() {
    }

    /**
     * Consecutive completed days ending today, or ending yesterday when today has no completion
     * yet. A streak only breaks once a whole day was skipped.
     */
    public static int currentStreak(Collection<LocalDate> days, LocalDate today) {
        if (days == null || days.isEmpty() || today == null) {
            return 0;
        }
        Set<LocalDate> completed = days instanceof Set ? (Set<LocalDate>) days : new HashSet<>(days);

        LocalDate checkDate = today;
        if (!completed.contains(checkDate)) {
            checkDate = today.minusDays(1);
            if (!completed.contains(checkDate)) {
                return 0;
            }
        }

        int streak = 0;
        while (completed.contains(checkDate)) {
            streak++;
            checkDate = checkDate.minusDays(1);
        }
        return streak;
    }

    /**
     * Longest run of consecutive calendar days anywhere in the history.
     */
    public static int longestStreak(Collection<LocalDate> days) {
        if (days == null || days.isEmpty()) {
            return 0;
        }
        TreeSet<LocalDate> sorted = new TreeSet<>();
        for (LocalDate day : days) {
            if (day != null) {
                sorted.add(day);
            }
        }
        if (sorted.isEmpty()) {
            return 0;
        }

        int best = 1;
        int current = 1;
        LocalDate previous = null;
        for (LocalDate day : sorted) {
            if (previous != null) {
                if (day.equals(previous.plusDays(1))) {
                    current++;
                    best = Math.max(best, current);
                } else {
                    current = 1;
                }
            }
            previous = day;
        }
        return best;
    }

    /**
     * Longest run of consecutive scheduled occurrences that were all completed. Days between
     * two scheduled occurrences do not break the run; completions on unscheduled days are
     * ignored.
     *
     * @param scheduledDays due days in ascending order
     */
    public static int longestScheduledRun(Collection<LocalDate> days, List<LocalDate> scheduledDays) {
        if (days == null || days.isEmpty() || scheduledDays == null || scheduledDays.isEmpty()) {
            return 0;
        }
        Set<LocalDate> completed = new HashSet<>(days);

        int best = 0;
        int current = 0;
        for (LocalDate day : scheduledDays) {
            if (completed.contains(Objects.requireNonNull(day))) {
                current++;
                best = Math.max(best, current);
            } else {
                current = 0;
            }
        }
        return best;
    }
}
