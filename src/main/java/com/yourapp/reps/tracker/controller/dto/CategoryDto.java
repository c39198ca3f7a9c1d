package com.yourapp.reps.tracker.controller.dto;

public record CategoryDto(Long id, String name, String iconName, String colorHex, int sortOrder) {
}
