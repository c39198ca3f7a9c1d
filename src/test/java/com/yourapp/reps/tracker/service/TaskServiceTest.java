package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.Category;
import com.yourapp.reps.tracker.model.RecurrenceRule;
import com.yourapp.reps.tracker.model.RecurrenceType;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.repository.CategoryRepository;
import com.yourapp.reps.tracker.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 20);

    @Mock
    private TaskRepository taskRepo;

    @Mock
    private CategoryRepository categoryRepo;

    private TaskService taskService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(TODAY.atTime(8, 30).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        CalendarDays calendarDays = new CalendarDays(clock, DayOfWeek.SUNDAY);
        taskService = new TaskService(taskRepo, categoryRepo, new TaskStatsService(calendarDays, taskRepo), calendarDays);

        when(taskRepo.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(categoryRepo.save(any(Category.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void createTaskStampsOrderAndCreationTime() {
        when(taskRepo.findMaxSortOrder()).thenReturn(4);

        Task task = taskService.createTask("  Read  ", " Mind ", RecurrenceRule.daily(), null);

        assertThat(task.getTitle()).isEqualTo("Read");
        assertThat(task.getCategory()).isEqualTo("Mind");
        assertThat(task.getSortOrder()).isEqualTo(5);
        assertThat(task.getCreatedAt()).isEqualTo(TODAY.atTime(8, 30));
        assertThat(task.isActive()).isTrue();
        assertThat(task.getRecurrenceRule()).isEqualTo(RecurrenceRule.daily());
    }

    @Test
    void createTaskKeepsOnlyUsefulStartDates() {
        Task daily = taskService.createTask("Run", null, RecurrenceRule.daily(), TODAY.plusDays(3));
        Task past = taskService.createTask("Run", null, RecurrenceRule.daily(), TODAY.minusDays(3));
        Task weekly = taskService.createTask("Run", null, RecurrenceRule.weekly(DayOfWeek.MONDAY), TODAY.plusDays(3));

        assertThat(daily.getStartDate()).isEqualTo(TODAY.plusDays(3));
        assertThat(past.getStartDate()).isNull();
        assertThat(weekly.getStartDate()).isNull();
    }

    @Test
    void createTaskRejectsBlankTitleAndEmptySelections() {
        assertThatThrownBy(() -> taskService.createTask(" ", null, RecurrenceRule.daily(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> taskService.createTask("Gym", null, RecurrenceRule.weekly(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> taskService.createTask("Bills", null, RecurrenceRule.monthly(), null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(taskRepo, never()).save(any(Task.class));
    }

    @Test
    void createTaskWithoutRuleIsOneTime() {
        Task task = taskService.createTask("Call mom", null, null, null);

        assertThat(task.getRecurrenceRule().getType()).isEqualTo(RecurrenceType.NONE);
    }

    @Test
    void updateTaskLeavesCompletionsAlone() {
        Task task = existing(1L, RecurrenceRule.none());
        CompletionLedger.of(task).toggle(TODAY.minusDays(1), TODAY.minusDays(1).atTime(9, 0));

        Task updated = taskService.updateTask(1L, "Renamed", null, RecurrenceRule.weekly(DayOfWeek.MONDAY), TODAY);

        assertThat(updated.getTitle()).isEqualTo("Renamed");
        assertThat(updated.getRecurrenceRule()).isEqualTo(RecurrenceRule.weekly(DayOfWeek.MONDAY));
        assertThat(updated.getStartDate()).isNull();
        assertThat(updated.getCompletions()).hasSize(1);
        assertThat(updated.getUpdatedAt()).isEqualTo(TODAY.atTime(8, 30));
    }

    @Test
    void toggleCompletionFlipsToday() {
        Task task = existing(7L, RecurrenceRule.daily());

        assertThat(taskService.toggleCompletion(7L)).isTrue();
        assertThat(CompletionLedger.of(task).isCompletedOn(TODAY)).isTrue();
        assertThat(task.getCompletions().get(0).getCompletedAt()).isEqualTo(TODAY.atTime(8, 30));

        assertThat(taskService.toggleCompletion(7L)).isFalse();
        assertThat(task.getCompletions()).isEmpty();
        verify(taskRepo).saveAndFlush(task);
    }

    @Test
    void toggleCompletionOfAnEarlierDay() {
        Task task = existing(7L, RecurrenceRule.daily());

        assertThat(taskService.toggleCompletion(7L, TODAY.minusDays(2))).isTrue();

        assertThat(CompletionLedger.of(task).occurrenceDays()).containsExactly(TODAY.minusDays(2));
        verify(taskRepo).save(task);
    }

    @Test
    void getTaskFailsForMissingOrNullId() {
        when(taskRepo.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> taskService.getTask(99L))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessageContaining("99");
        assertThatThrownBy(() -> taskService.getTask(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void todayListHidesFinishedAndUnscheduledTasks() {
        Task daily = existing(1L, RecurrenceRule.daily());
        Task done = existing(2L, RecurrenceRule.daily());
        CompletionLedger.of(done).toggle(TODAY, TODAY.atTime(7, 0));
        Task sundays = existing(3L, RecurrenceRule.weekly(DayOfWeek.SUNDAY));
        when(taskRepo.findByActiveTrueOrderBySortOrderAsc()).thenReturn(List.of(daily, done, sundays));

        assertThat(taskService.getTodayTasks()).containsExactly(daily);
    }

    @Test
    void deleteAndArchive() {
        Task task = existing(5L, RecurrenceRule.daily());

        taskService.archiveTask(5L);
        assertThat(task.isActive()).isFalse();

        taskService.deleteTask(5L);
        verify(taskRepo).delete(task);
    }

    @Test
    void reorderAssignsPositionsAndSkipsUnknownIds() {
        Task first = existing(1L, RecurrenceRule.daily());
        Task second = existing(2L, RecurrenceRule.daily());
        second.setSortOrder(9);
        when(taskRepo.findAllById(List.of(2L, 42L, 1L))).thenReturn(List.of(first, second));

        taskService.reorderTasks(List.of(2L, 42L, 1L));

        assertThat(second.getSortOrder()).isZero();
        assertThat(first.getSortOrder()).isEqualTo(1);
    }

    @Test
    void createCategoryRejectsDuplicates() {
        Category existing = new Category();
        existing.setName("Health");
        when(categoryRepo.findByNameIgnoreCase("health")).thenReturn(Optional.of(existing));
        when(categoryRepo.findByNameIgnoreCase("Work")).thenReturn(Optional.empty());
        when(categoryRepo.findMaxSortOrder()).thenReturn(2);

        assertThatThrownBy(() -> taskService.createCategory(" health ", null, null))
                .isInstanceOf(IllegalArgumentException.class);

        Category created = taskService.createCategory("Work", "briefcase", "#3366ff");
        assertThat(created.getName()).isEqualTo("Work");
        assertThat(created.getSortOrder()).isEqualTo(3);
    }

    private Task existing(Long id, RecurrenceRule rule) {
        Task task = new Task("Task " + id, null, rule);
        task.setId(id);
        task.setCreatedAt(LocalDateTime.of(2026, 1, 1, 9, 0));
        when(taskRepo.findById(id)).thenReturn(Optional.of(task));
        return task;
    }
}
