package com.yourapp.reps.tracker.model;

/**
 * Defines the recurrence pattern for tasks.
 */
public enum RecurrenceType {
    /**
     * One-time task, gone from the due list once completed
     */
    NONE,

    /**
     * Repeats every day
     */
    DAILY,

    /**
     * Repeats on selected days of the week
     */
    WEEKLY,

    /**
     * Repeats on selected days of the month
     */
    MONTHLY
}
