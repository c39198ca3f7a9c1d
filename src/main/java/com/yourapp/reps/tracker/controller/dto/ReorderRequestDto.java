package com.yourapp.reps.tracker.controller.dto;

import java.util.List;

public record ReorderRequestDto(List<Long> taskIds) {
}
