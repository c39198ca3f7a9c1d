package com.yourapp.reps.tracker.controller.dto;

import java.time.LocalDate;

public record ToggleResponseDto(Long taskId, LocalDate day, boolean completed) {
}
