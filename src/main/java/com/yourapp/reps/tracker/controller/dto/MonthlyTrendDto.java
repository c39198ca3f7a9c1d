package com.yourapp.reps.tracker.controller.dto;

public record MonthlyTrendDto(String month, int thisMonthCount, int lastMonthCount,
                              Integer changePercent, boolean positive) {
}
