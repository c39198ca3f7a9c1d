package com.yourapp.reps.tracker.service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns timestamps into local calendar days and answers "what is today".
 *
 * <p>Every comparison in the tracker is done on {@link LocalDate} values produced here, never
 * on raw timestamps, so the time a task was ticked off has no effect on which day it counts for.
 * The clock carries the zone; a fixed clock makes the whole engine deterministic.
 */
public class CalendarDays {

    private final Clock clock;
    private final DayOfWeek firstDayOfWeek;
    private final List<DayOfWeek> orderedWeek;

    public CalendarDays(Clock clock, DayOfWeek firstDayOfWeek) {
        this.clock = clock != null ? clock : Clock.systemDefaultZone();
        this.firstDayOfWeek = firstDayOfWeek != null ? firstDayOfWeek : DayOfWeek.SUNDAY;

        List<DayOfWeek> week = new ArrayList<>(7);
        for (int i = 0; i < 7; i++) {
            week.add(this.firstDayOfWeek.plus(i));
        }
        this.orderedWeek = Collections.unmodifiableList(week);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Wall-clock time in the calendar zone, used as the completion timestamp.
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public LocalDate dayOf(Instant instant) {
        if (instant == null) {
            return null;
        }
        return instant.atZone(zone()).toLocalDate();
    }

    public LocalDate dayOf(LocalDateTime dateTime) {
        return dateTime != null ? dateTime.toLocalDate() : null;
    }

    /**
     * Position of the weekday in the local week, 1 being the first day of week.
     */
    public int weekdayNumber(DayOfWeek day) {
        return Math.floorMod(day.getValue() - firstDayOfWeek.getValue(), 7) + 1;
    }

    /**
     * Inverse of {@link #weekdayNumber(DayOfWeek)}.
     *
     * @throws IllegalArgumentException if the number is outside 1..7
     */
    public DayOfWeek dayOfWeek(int number) {
        if (number < 1 || number > 7) {
            throw new IllegalArgumentException("Weekday number must be between 1 and 7: " + number);
        }
        return orderedWeek.get(number - 1);
    }

    public List<DayOfWeek> orderedWeek() {
        return orderedWeek;
    }

    public DayOfWeek getFirstDayOfWeek() {
        return firstDayOfWeek;
    }

    public ZoneId zone() {
        return clock.getZone();
    }
}
