package com.yourapp.reps.tracker.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable recurrence rule of a task: the {@link RecurrenceType} plus the weekday or
 * day-of-month selection it needs.
 *
 * <p>Selections that do not belong to the type are dropped, so a DAILY rule never carries
 * weekdays and a WEEKLY rule never carries month days. An empty selection on a WEEKLY or
 * MONTHLY rule is representable but never due.
 */
public final class RecurrenceRule {

    private static final RecurrenceRule NONE = new RecurrenceRule(RecurrenceType.NONE,
            EnumSet.noneOf(DayOfWeek.class), new TreeSet<>());
    private static final RecurrenceRule DAILY = new RecurrenceRule(RecurrenceType.DAILY,
            EnumSet.noneOf(DayOfWeek.class), new TreeSet<>());

    private final RecurrenceType type;
    private final Set<DayOfWeek> weekdays;
    private final SortedSet<Integer> monthDays;

    private RecurrenceRule(RecurrenceType type, EnumSet<DayOfWeek> weekdays, SortedSet<Integer> monthDays) {
        this.type = type;
        this.weekdays = Collections.unmodifiableSet(weekdays);
        this.monthDays = Collections.unmodifiableSortedSet(monthDays);
    }

    public static RecurrenceRule none() {
        return NONE;
    }

    public static RecurrenceRule daily() {
        return DAILY;
    }

    public static RecurrenceRule weekly(DayOfWeek... weekdays) {
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (DayOfWeek day : weekdays) {
            if (day != null) {
                days.add(day);
            }
        }
        return new RecurrenceRule(RecurrenceType.WEEKLY, days, new TreeSet<>());
    }

    public static RecurrenceRule weekly(Collection<DayOfWeek> weekdays) {
        return weekly(weekdays == null ? new DayOfWeek[0] : weekdays.toArray(new DayOfWeek[0]));
    }

    public static RecurrenceRule monthly(Integer... monthDays) {
        SortedSet<Integer> days = new TreeSet<>();
        for (Integer day : monthDays) {
            // 1-31 only, anything else can never match a calendar day
            if (day != null && day >= 1 && day <= 31) {
                days.add(day);
            }
        }
        return new RecurrenceRule(RecurrenceType.MONTHLY, EnumSet.noneOf(DayOfWeek.class), days);
    }

    public static RecurrenceRule monthly(Collection<Integer> monthDays) {
        return monthly(monthDays == null ? new Integer[0] : monthDays.toArray(new Integer[0]));
    }

    /**
     * Builds a rule from stored fields, keeping only the selection that matches the type.
     * A missing type is read as {@link RecurrenceType#NONE}.
     */
    public static RecurrenceRule of(RecurrenceType type, Collection<DayOfWeek> weekdays, Collection<Integer> monthDays) {
        if (type == null) {
            return NONE;
        }
        switch (type) {
            case DAILY:
                return DAILY;
            case WEEKLY:
                return weekly(weekdays);
            case MONTHLY:
                return monthly(monthDays);
            case NONE:
            default:
                return NONE;
        }
    }

    /**
     * First day an occurrence can exist: the later of the creation day and the start date.
     * A start date on or before the creation day is ignored.
     */
    public static LocalDate effectiveStart(LocalDate createdOn, LocalDate startDate) {
        if (createdOn == null) {
            return startDate;
        }
        if (startDate != null && startDate.isAfter(createdOn)) {
            return startDate;
        }
        return createdOn;
    }

    /**
     * Decides whether an occurrence is scheduled on {@code day}.
     *
     * <p>For NONE this is only the lower bound; whether a one-time task was already completed
     * is checked by the caller against the completion ledger. The start date only applies to
     * NONE and DAILY rules.
     */
    public boolean isDue(LocalDate day, LocalDate createdOn, LocalDate startDate) {
        if (day == null || createdOn == null) {
            return false;
        }
        switch (type) {
            case NONE:
            case DAILY:
                return !day.isBefore(effectiveStart(createdOn, startDate));
            case WEEKLY:
                return !day.isBefore(createdOn) && weekdays.contains(day.getDayOfWeek());
            case MONTHLY:
                // Feb 30 and friends simply never match, no rollover
                return !day.isBefore(createdOn) && monthDays.contains(day.getDayOfMonth());
            default:
                return false;
        }
    }

    public boolean isRecurring() {
        return type != RecurrenceType.NONE;
    }

    /**
     * True when the rule can never select a day: a WEEKLY or MONTHLY rule with nothing selected.
     */
    public boolean isEmptySelection() {
        return (type == RecurrenceType.WEEKLY && weekdays.isEmpty())
                || (type == RecurrenceType.MONTHLY && monthDays.isEmpty());
    }

    public RecurrenceType getType() {
        return type;
    }

    public Set<DayOfWeek> getWeekdays() {
        return weekdays;
    }

    public SortedSet<Integer> getMonthDays() {
        return monthDays;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecurrenceRule)) return false;
        RecurrenceRule that = (RecurrenceRule) o;
        return type == that.type && weekdays.equals(that.weekdays) && monthDays.equals(that.monthDays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, weekdays, monthDays);
    }

    @Override
    public String toString() {
        switch (type) {
            case WEEKLY:
                return "WEEKLY" + weekdays;
            case MONTHLY:
                return "MONTHLY" + monthDays;
            default:
                return type.name();
        }
    }
}
