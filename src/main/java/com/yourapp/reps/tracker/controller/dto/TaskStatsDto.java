package com.yourapp.reps.tracker.controller.dto;

/**
 * completionRate is null for one-time tasks.
 */
public record TaskStatsDto(
        boolean dueToday,
        boolean completedToday,
        int currentStreak,
        int bestStreak,
        int bestScheduledStreak,
        Integer completionRate,
        int totalCompletions
) {
}
