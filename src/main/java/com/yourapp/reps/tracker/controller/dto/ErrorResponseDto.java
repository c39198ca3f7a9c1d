package com.yourapp.reps.tracker.controller.dto;

public record ErrorResponseDto(String code, String message) {
}
