package com.yourapp.reps.tracker.model;

/**
 * Completion figures for one calendar year.
 */
public class YearSummary {
    private final int year;
    private final int totalCompletions;
    private final int activeDays;
    private final int bestDay;
    private final int longestStreak;

    public YearSummary(int year, int totalCompletions, int activeDays, int bestDay, int longestStreak) {
        this.year = year;
        this.totalCompletions = totalCompletions;
        this.activeDays = activeDays;
        this.bestDay = bestDay;
        this.longestStreak = longestStreak;
    }

    public int getYear() { return year; }
    public int getTotalCompletions() { return totalCompletions; }
    // days with at least one completion
    public int getActiveDays() { return activeDays; }
    // most completions on a single day
    public int getBestDay() { return bestDay; }
    public int getLongestStreak() { return longestStreak; }
}
