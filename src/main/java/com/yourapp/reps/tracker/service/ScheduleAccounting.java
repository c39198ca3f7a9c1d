package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.RecurrenceRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Counts the occurrences a rule actually schedules over a date range.
 *
 * <p>This is the denominator of a completion rate. A task due only on Mondays is measured
 * against its Mondays, not against every elapsed day.
 */
public final class ScheduleAccounting {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleAccounting.class);

    private ScheduleAccounting() {
    }

    /**
     * Scheduled days in {@code [from, through]}, treating {@code from} as the creation day.
     * Never less than 1.
     */
    public static int scheduledDayCount(RecurrenceRule rule, LocalDate from, LocalDate through) {
        return scheduledDayCount(rule, from, through, null);
    }

    /**
     * Scheduled days in {@code [from, through]} with an optional start date, clamped to at
     * least 1 so callers can divide by it.
     */
    public static int scheduledDayCount(RecurrenceRule rule, LocalDate from, LocalDate through, LocalDate startDate) {
        long count = countDueDays(rule, from, through, startDate);
        return (int) Math.max(1, Math.min(count, Integer.MAX_VALUE));
    }

    /**
     * Every day in {@code [from, through]} on which the rule is due, ascending.
     */
    public static List<LocalDate> scheduledDays(RecurrenceRule rule, LocalDate from, LocalDate through, LocalDate startDate) {
        if (rule == null || from == null || through == null || through.isBefore(from)) {
            return List.of();
        }
        return from.datesUntil(through.plusDays(1))
                .filter(day -> rule.isDue(day, from, startDate))
                .collect(Collectors.toList());
    }

    /**
     * Unclamped number of due days; 0 for an empty or inverted range.
     */
    static long countDueDays(RecurrenceRule rule, LocalDate from, LocalDate through, LocalDate startDate) {
        if (rule == null || from == null || through == null || through.isBefore(from)) {
            return 0;
        }
        if (rule.isEmptySelection()) {
            logger.debug("Rule {} selects no days, nothing is scheduled", rule);
            return 0;
        }

        switch (rule.getType()) {
            case NONE:
            case DAILY:
                return countDaily(RecurrenceRule.effectiveStart(from, startDate), through);
            case WEEKLY:
                return countWeekly(rule, from, through);
            case MONTHLY:
                return countMonthly(rule, from, through);
            default:
                return 0;
        }
    }

    private static long countDaily(LocalDate start, LocalDate through) {
        if (start.isAfter(through)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(start, through) + 1;
    }

    private static long countWeekly(RecurrenceRule rule, LocalDate from, LocalDate through) {
        long totalDays = ChronoUnit.DAYS.between(from, through) + 1;
        long fullWeeks = totalDays / 7;
        long count = fullWeeks * rule.getWeekdays().size();

        // leftover partial week
        LocalDate day = from.plusDays(fullWeeks * 7);
        while (!day.isAfter(through)) {
            if (rule.getWeekdays().contains(day.getDayOfWeek())) {
                count++;
            }
            day = day.plusDays(1);
        }
        return count;
    }

    private static long countMonthly(RecurrenceRule rule, LocalDate from, LocalDate through) {
        long count = 0;
        YearMonth month = YearMonth.from(from);
        YearMonth last = YearMonth.from(through);
        while (!month.isAfter(last)) {
            for (Integer dayOfMonth : rule.getMonthDays()) {
                if (dayOfMonth > month.lengthOfMonth()) {
                    // sorted, so later days won't fit either
                    break;
                }
                LocalDate day = month.atDay(dayOfMonth);
                if (!day.isBefore(from) && !day.isAfter(through)) {
                    count++;
                }
            }
            month = month.plusMonths(1);
        }
        return count;
    }
}
