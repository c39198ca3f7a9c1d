package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.RecurrenceRule;
import com.yourapp.reps.tracker.model.StatsSummary;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.model.TaskStats;
import com.yourapp.reps.tracker.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class TaskStatsServiceTest {

    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);

    @Mock
    private TaskRepository taskRepo;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void weeklyScenarioForJanuary2026() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 31));
        Task task = task(RecurrenceRule.weekly(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY), JAN_1,
                LocalDate.of(2026, 1, 5), LocalDate.of(2026, 1, 7),
                LocalDate.of(2026, 1, 9), LocalDate.of(2026, 1, 12));

        // 4 of 13 scheduled days, rounded down
        assertThat(service.completionRate(task)).hasValue(30);
        assertThat(service.bestStreak(task)).isEqualTo(1);
        assertThat(service.bestScheduledStreak(task)).isEqualTo(4);
        assertThat(service.currentStreak(task)).isZero();
        assertThat(service.isDueToday(task)).isFalse();
    }

    @Test
    void everyMondayForEightWeeksIsAFullRate() {
        LocalDate firstMonday = LocalDate.of(2026, 1, 5);
        LocalDate lastMonday = firstMonday.plusWeeks(7);
        Task task = task(RecurrenceRule.weekly(DayOfWeek.MONDAY), firstMonday);
        for (int week = 0; week < 8; week++) {
            CompletionLedger.of(task).toggle(firstMonday.plusWeeks(week), firstMonday.plusWeeks(week).atTime(7, 0));
        }

        TaskStatsService service = serviceAt(lastMonday);

        assertThat(service.completionRate(task)).hasValue(100);
        assertThat(service.isDueToday(task)).isTrue();
        assertThat(service.isCompletedToday(task)).isTrue();
        assertThat(service.bestScheduledStreak(task)).isEqualTo(8);
        assertThat(service.currentStreak(task)).isEqualTo(1);
    }

    @Test
    void rateIsCappedAtOneHundred() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 2));
        Task task = task(RecurrenceRule.weekly(DayOfWeek.MONDAY), JAN_1, JAN_1, LocalDate.of(2026, 1, 2));

        assertThat(service.completionRate(task)).hasValue(100);
    }

    @Test
    void dailyRateStartsAtTheStartDate() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 20));
        Task task = task(RecurrenceRule.daily(), JAN_1,
                LocalDate.of(2026, 1, 5),
                LocalDate.of(2026, 1, 11), LocalDate.of(2026, 1, 12), LocalDate.of(2026, 1, 13),
                LocalDate.of(2026, 1, 14), LocalDate.of(2026, 1, 15));
        task.setStartDate(LocalDate.of(2026, 1, 11));

        // 5 of the 10 days from Jan 11 through Jan 20
        assertThat(service.completionRate(task)).hasValue(50);
        assertThat(service.isDueOn(task, LocalDate.of(2026, 1, 10))).isFalse();
        assertThat(service.isDueOn(task, LocalDate.of(2026, 1, 11))).isTrue();
    }

    @Test
    void oneTimeTaskIsDueUntilCompleted() {
        LocalDate today = LocalDate.of(2026, 1, 10);
        TaskStatsService service = serviceAt(today);
        Task task = task(RecurrenceRule.none(), JAN_1);

        assertThat(service.isDueToday(task)).isTrue();
        assertThat(service.completionRate(task)).isEmpty();

        CompletionLedger.of(task).toggle(today, today.atTime(10, 0));
        assertThat(service.isDueToday(task)).isFalse();
        assertThat(service.isCompletedToday(task)).isTrue();

        CompletionLedger.of(task).toggle(today, today.atTime(10, 5));
        assertThat(service.isDueToday(task)).isTrue();
    }

    @Test
    void oneTimeTaskWithFutureStartIsNotDueYet() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 10));
        Task task = task(RecurrenceRule.none(), JAN_1);
        task.setStartDate(LocalDate.of(2026, 1, 15));

        assertThat(service.isDueToday(task)).isFalse();
        assertThat(service.isDueOn(task, LocalDate.of(2026, 1, 15))).isTrue();
    }

    @Test
    void archivedOrUndatedTasksAreNeverDue() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 10));
        Task archived = task(RecurrenceRule.daily(), JAN_1);
        archived.setActive(false);
        Task undated = task(RecurrenceRule.daily(), JAN_1);
        undated.setCreatedAt(null);

        assertThat(service.isDueToday(archived)).isFalse();
        assertThat(service.isDueToday(undated)).isFalse();
        assertThat(service.completionRate(undated)).isEmpty();
    }

    @Test
    void emptySelectionHasNoRateAndIsNeverDue() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 10));
        Task task = task(RecurrenceRule.weekly(), JAN_1);

        assertThat(service.isDueToday(task)).isFalse();
        assertThat(service.completionRate(task)).isEmpty();
    }

    @Test
    void statsForCollectsEveryFigure() {
        LocalDate today = LocalDate.of(2026, 1, 20);
        TaskStatsService service = serviceAt(today);
        Task task = task(RecurrenceRule.daily(), JAN_1,
                LocalDate.of(2026, 1, 3), LocalDate.of(2026, 1, 4),
                LocalDate.of(2026, 1, 18), LocalDate.of(2026, 1, 19));

        TaskStats stats = service.statsFor(task);

        assertThat(stats.isDueToday()).isTrue();
        assertThat(stats.isCompletedToday()).isFalse();
        assertThat(stats.getCurrentStreak()).isEqualTo(2);
        assertThat(stats.getBestStreak()).isEqualTo(2);
        assertThat(stats.getCompletionRate()).hasValue(20);
        assertThat(stats.getTotalCompletions()).isEqualTo(4);
    }

    @Test
    void summaryRollsUpDaysAndRates() {
        LocalDate today = LocalDate.of(2026, 1, 20);
        TaskStatsService service = serviceAt(today);
        Task daily = task(RecurrenceRule.daily(), JAN_1, LocalDate.of(2026, 1, 18), LocalDate.of(2026, 1, 19));
        Task mondays = task(RecurrenceRule.weekly(DayOfWeek.MONDAY), JAN_1,
                LocalDate.of(2026, 1, 12), LocalDate.of(2026, 1, 19));
        Task once = task(RecurrenceRule.none(), JAN_1, today);

        StatsSummary summary = service.summarize(List.of(daily, mondays, once));

        assertThat(summary.getTaskCount()).isEqualTo(3);
        assertThat(summary.getDueToday()).isEqualTo(1);
        assertThat(summary.getCompletedToday()).isEqualTo(1);
        assertThat(summary.getTotalCompletions()).isEqualTo(5);
        assertThat(summary.getCurrentStreak()).isEqualTo(3);
        assertThat(summary.getBestStreak()).isEqualTo(3);
        // (2 + 2) of (20 + 3)
        assertThat(summary.getCompletionRate()).hasValue(17);
    }

    @Test
    void archivedTaskCountsAsHistoryButNotToday() {
        LocalDate today = LocalDate.of(2026, 1, 20);
        TaskStatsService service = serviceAt(today);
        Task archived = task(RecurrenceRule.daily(), JAN_1, today.minusDays(1), today);
        archived.setActive(false);

        StatsSummary summary = service.summarize(List.of(archived));

        assertThat(summary.getDueToday()).isZero();
        assertThat(summary.getCompletedToday()).isZero();
        assertThat(summary.getTotalCompletions()).isEqualTo(2);
        assertThat(summary.getCurrentStreak()).isEqualTo(2);
    }

    @Test
    void categorySummaryUsesTheCategoryMembers() {
        LocalDate today = LocalDate.of(2026, 1, 20);
        TaskStatsService service = serviceAt(today);
        Task daily = task(RecurrenceRule.daily(), JAN_1, LocalDate.of(2026, 1, 18), LocalDate.of(2026, 1, 19));
        Task mondays = task(RecurrenceRule.weekly(DayOfWeek.MONDAY), JAN_1,
                LocalDate.of(2026, 1, 12), LocalDate.of(2026, 1, 19));
        when(taskRepo.findByCategoryOrderBySortOrderAsc("Fitness")).thenReturn(List.of(daily, mondays));

        StatsSummary summary = service.summarizeCategory("Fitness");

        assertThat(summary.getTaskCount()).isEqualTo(2);
        assertThat(summary.getCurrentStreak()).isEqualTo(2);
        assertThat(summary.getCompletionRate()).hasValue(17);
    }

    @Test
    void summaryWithoutRecurringTasksHasNoRate() {
        TaskStatsService service = serviceAt(LocalDate.of(2026, 1, 20));
        when(taskRepo.findAll()).thenReturn(List.of(task(RecurrenceRule.none(), JAN_1)));

        assertThat(service.summarizeAll().getCompletionRate()).isEmpty();
        assertThat(service.summarize(List.of()).getTaskCount()).isZero();
        assertThat(service.summarize(List.of()).getCompletionRate()).isEmpty();
    }

    private TaskStatsService serviceAt(LocalDate today) {
        Clock clock = Clock.fixed(today.atTime(12, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new TaskStatsService(new CalendarDays(clock, DayOfWeek.SUNDAY), taskRepo);
    }

    private static Task task(RecurrenceRule rule, LocalDate createdOn, LocalDate... completedDays) {
        Task task = new Task("Task", "Fitness", rule);
        task.setCreatedAt(createdOn.atTime(9, 0));
        for (LocalDate day : completedDays) {
            CompletionLedger.of(task).toggle(day, day.atTime(20, 0));
        }
        return task;
    }
}
