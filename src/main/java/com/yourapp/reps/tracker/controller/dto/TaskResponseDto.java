package com.yourapp.reps.tracker.controller.dto;

import com.yourapp.reps.tracker.model.RecurrenceType;

import java.time.LocalDate;
import java.util.List;

public record TaskResponseDto(
        Long id,
        String title,
        String category,
        RecurrenceType recurrenceType,
        List<Integer> weekdays,
        List<Integer> monthDays,
        LocalDate startDate,
        LocalDate createdOn,
        boolean active,
        int sortOrder,
        TaskStatsDto stats
) {
}
