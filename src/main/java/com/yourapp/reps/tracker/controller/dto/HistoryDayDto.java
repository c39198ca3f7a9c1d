package com.yourapp.reps.tracker.controller.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record HistoryDayDto(LocalDate day, List<Entry> completions) {

    public record Entry(Long completionId, Long taskId, String title, String category, LocalDateTime completedAt) {
    }
}
