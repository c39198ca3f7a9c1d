package com.yourapp.reps.tracker.controller.dto;

public record StatsSummaryDto(
        String scope,
        int taskCount,
        int dueToday,
        int completedToday,
        int totalCompletions,
        int currentStreak,
        int bestStreak,
        Integer completionRate
) {
}
