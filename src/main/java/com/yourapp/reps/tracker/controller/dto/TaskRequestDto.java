package com.yourapp.reps.tracker.controller.dto;

import com.yourapp.reps.tracker.model.RecurrenceType;

import java.time.LocalDate;
import java.util.List;

/**
 * Create/update payload. Weekdays are numbered 1-7 from the configured first day of week.
 */
public record TaskRequestDto(
        String title,
        String category,
        RecurrenceType recurrenceType,
        List<Integer> weekdays,
        List<Integer> monthDays,
        LocalDate startDate
) {
}
