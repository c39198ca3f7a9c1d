package com.yourapp.reps.tracker.model;

import java.util.OptionalInt;

/**
 * Derived figures for one task as of a given day. Recomputed from the completions on every
 * request, never stored.
 */
public class TaskStats {
    private final boolean dueToday;
    private final boolean completedToday;
    private final int currentStreak;
    private final int bestStreak;
    private final int bestScheduledStreak;
    private final OptionalInt completionRate;
    private final int totalCompletions;

    public TaskStats(boolean dueToday, boolean completedToday, int currentStreak, int bestStreak,
                     int bestScheduledStreak, OptionalInt completionRate, int totalCompletions) {
        this.dueToday = dueToday;
        this.completedToday = completedToday;
        this.currentStreak = currentStreak;
        this.bestStreak = bestStreak;
        this.bestScheduledStreak = bestScheduledStreak;
        this.completionRate = completionRate != null ? completionRate : OptionalInt.empty();
        this.totalCompletions = totalCompletions;
    }

    public boolean isDueToday() { return dueToday; }
    public boolean isCompletedToday() { return completedToday; }
    public int getCurrentStreak() { return currentStreak; }
    public int getBestStreak() { return bestStreak; }
    public int getBestScheduledStreak() { return bestScheduledStreak; }
    // empty for one-time tasks
    public OptionalInt getCompletionRate() { return completionRate; }
    public int getTotalCompletions() { return totalCompletions; }
}
