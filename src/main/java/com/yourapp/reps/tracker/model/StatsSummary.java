package com.yourapp.reps.tracker.model;

import java.util.OptionalInt;

/**
 * Statistics rolled up over several tasks, e.g. one category or everything.
 * Streaks run over the union of the members' completed days; the rate is blended from the
 * summed completed and scheduled counts of the recurring members.
 */
public class StatsSummary {
    private final int taskCount;
    private final int dueToday;
    private final int completedToday;
    private final int totalCompletions;
    private final int currentStreak;
    private final int bestStreak;
    private final OptionalInt completionRate;

    public StatsSummary(int taskCount, int dueToday, int completedToday, int totalCompletions,
                        int currentStreak, int bestStreak, OptionalInt completionRate) {
        this.taskCount = taskCount;
        this.dueToday = dueToday;
        this.completedToday = completedToday;
        this.totalCompletions = totalCompletions;
        this.currentStreak = currentStreak;
        this.bestStreak = bestStreak;
        this.completionRate = completionRate != null ? completionRate : OptionalInt.empty();
    }

    public static StatsSummary empty() {
        return new StatsSummary(0, 0, 0, 0, 0, 0, OptionalInt.empty());
    }

    public int getTaskCount() { return taskCount; }
    public int getDueToday() { return dueToday; }
    public int getCompletedToday() { return completedToday; }
    public int getTotalCompletions() { return totalCompletions; }
    public int getCurrentStreak() { return currentStreak; }
    public int getBestStreak() { return bestStreak; }
    public OptionalInt getCompletionRate() { return completionRate; }
}
