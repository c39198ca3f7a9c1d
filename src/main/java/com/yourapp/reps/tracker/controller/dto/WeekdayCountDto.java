package com.yourapp.reps.tracker.controller.dto;

import java.time.DayOfWeek;

public record WeekdayCountDto(int weekday, DayOfWeek dayOfWeek, int count) {
}
