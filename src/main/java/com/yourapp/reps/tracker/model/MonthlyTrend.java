package com.yourapp.reps.tracker.model;

import java.time.YearMonth;
import java.util.OptionalInt;

public class MonthlyTrend {
    private final YearMonth month;
    private final int thisMonthCount;
    private final int lastMonthCount;
    private final OptionalInt changePercent; // empty when last month had nothing

    public MonthlyTrend(YearMonth month, int thisMonthCount, int lastMonthCount, OptionalInt changePercent) {
        this.month = month;
        this.thisMonthCount = thisMonthCount;
        this.lastMonthCount = lastMonthCount;
        this.changePercent = changePercent != null ? changePercent : OptionalInt.empty();
    }

    public YearMonth getMonth() { return month; }
    public int getThisMonthCount() { return thisMonthCount; }
    public int getLastMonthCount() { return lastMonthCount; }
    public OptionalInt getChangePercent() { return changePercent; }

    public boolean isPositive() {
        return thisMonthCount >= lastMonthCount;
    }
}
