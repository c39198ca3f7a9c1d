package com.yourapp.reps.tracker.service;

import com.yourapp.reps.tracker.model.Category;
import com.yourapp.reps.tracker.model.RecurrenceRule;
import com.yourapp.reps.tracker.model.RecurrenceType;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.repository.CategoryRepository;
import com.yourapp.reps.tracker.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class TaskService {
    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepo;
    private final CategoryRepository categoryRepo;
    private final TaskStatsService statsService;
    private final CalendarDays calendarDays;

    public TaskService(TaskRepository taskRepo,
                       CategoryRepository categoryRepo,
                       TaskStatsService statsService,
                       CalendarDays calendarDays) {
        this.taskRepo = taskRepo;
        this.categoryRepo = categoryRepo;
        this.statsService = statsService;
        this.calendarDays = calendarDays;
    }

    public List<Task> getActiveTasks() {
        return taskRepo.findByActiveTrueOrderBySortOrderAsc();
    }

    public Task getTask(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        return taskRepo.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    /**
     * Tasks for today's list: due today and not yet ticked off today.
     */
    public List<Task> getTodayTasks() {
        return getActiveTasks().stream()
                .filter(statsService::isDueToday)
                .filter(task -> !statsService.isCompletedToday(task))
                .collect(Collectors.toList());
    }

    public List<Task> getTasksInCategory(String category) {
        return taskRepo.findByCategoryOrderBySortOrderAsc(category);
    }

    @Transactional
    public Task createTask(String title, String category, RecurrenceRule rule, LocalDate startDate) {
        RecurrenceRule recurrence = validateRule(rule);
        LocalDateTime now = calendarDays.now();

        Task task = new Task(validateTitle(title), normalizeCategory(category), recurrence);
        task.setStartDate(normalizeStartDate(recurrence, startDate, now.toLocalDate()));
        task.setActive(true);
        task.setSortOrder(taskRepo.findMaxSortOrder() + 1);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);

        Task saved = taskRepo.save(task);
        logger.info("Created task {} '{}' with rule {}", saved.getId(), saved.getTitle(), recurrence);
        return saved;
    }

    /**
     * Edits a task. Completions are left untouched whatever the new rule is; switching to a
     * weekly or monthly rule clears the start date.
     */
    @Transactional
    public Task updateTask(Long id, String title, String category, RecurrenceRule rule, LocalDate startDate) {
        Task task = getTask(id);
        RecurrenceRule recurrence = validateRule(rule);

        task.setTitle(validateTitle(title));
        task.setCategory(normalizeCategory(category));
        task.setRecurrenceRule(recurrence);
        task.setStartDate(normalizeStartDate(recurrence, startDate, calendarDays.dayOf(task.getCreatedAt())));
        task.setUpdatedAt(calendarDays.now());

        Task saved = taskRepo.save(task);
        logger.info("Updated task {} to rule {} starting {}", saved.getId(), recurrence, saved.getStartDate());
        return saved;
    }

    /**
     * Toggles today's completion of a task.
     *
     * @return true if the task is completed for today afterwards
     */
    @Transactional
    public boolean toggleCompletion(Long id) {
        return toggleCompletion(id, calendarDays.today());
    }

    /**
     * Toggles the completion of one occurrence day. Used by the app and by any outside trigger,
     * so both have the same effect.
     *
     * @return true if the day is completed afterwards
     */
    @Transactional
    public boolean toggleCompletion(Long id, LocalDate day) {
        Task task = getTask(id);
        LocalDate occurrenceDay = day != null ? day : calendarDays.today();

        boolean completed = CompletionLedger.of(task).toggle(occurrenceDay, calendarDays.now());
        if (completed) {
            taskRepo.save(task);
        } else {
            // the delete must reach the database before a later insert for the same day
            taskRepo.saveAndFlush(task);
        }

        logger.info("Task {} {} for {}", task.getId(), completed ? "completed" : "un-completed", occurrenceDay);
        return completed;
    }

    /**
     * Deletes the task together with all of its completions.
     */
    @Transactional
    public void deleteTask(Long id) {
        Task task = getTask(id);
        taskRepo.delete(task);
        logger.info("Deleted task {} and its completion history", id);
    }

    /**
     * Hides the task from every due and today computation but keeps its history.
     */
    @Transactional
    public void archiveTask(Long id) {
        Task task = getTask(id);
        task.setActive(false);
        task.setUpdatedAt(calendarDays.now());
        taskRepo.save(task);
        logger.info("Archived task {}", id);
    }

    /**
     * Assigns sort orders by position in {@code orderedIds}. Unknown ids are skipped.
     */
    @Transactional
    public void reorderTasks(List<Long> orderedIds) {
        if (orderedIds == null || orderedIds.isEmpty()) {
            return;
        }
        Map<Long, Task> byId = taskRepo.findAllById(orderedIds).stream()
                .collect(Collectors.toMap(Task::getId, Function.identity()));

        int index = 0;
        for (Long id : orderedIds) {
            Task task = byId.get(id);
            if (task == null) {
                logger.warn("Skipping unknown task {} while reordering", id);
                continue;
            }
            task.setSortOrder(index++);
        }
        taskRepo.saveAll(byId.values());
    }

    public List<Category> getCategories() {
        return categoryRepo.findAllByOrderBySortOrderAsc();
    }

    @Transactional
    public Category createCategory(String name, String iconName, String colorHex) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Category name cannot be empty");
        }
        String trimmed = name.trim();
        if (categoryRepo.findByNameIgnoreCase(trimmed).isPresent()) {
            throw new IllegalArgumentException("Category already exists: " + trimmed);
        }

        Category category = new Category();
        category.setName(trimmed);
        category.setIconName(iconName);
        category.setColorHex(colorHex);
        category.setSortOrder(categoryRepo.findMaxSortOrder() + 1);
        category.setCreatedAt(calendarDays.now());

        Category saved = categoryRepo.save(category);
        logger.info("Created category '{}'", saved.getName());
        return saved;
    }

    private String validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title cannot be empty");
        }
        return title.trim();
    }

    private RecurrenceRule validateRule(RecurrenceRule rule) {
        RecurrenceRule recurrence = rule != null ? rule : RecurrenceRule.none();
        if (recurrence.getType() == RecurrenceType.WEEKLY && recurrence.getWeekdays().isEmpty()) {
            throw new IllegalArgumentException("A weekly task needs at least one weekday");
        }
        if (recurrence.getType() == RecurrenceType.MONTHLY && recurrence.getMonthDays().isEmpty()) {
            throw new IllegalArgumentException("A monthly task needs at least one day of the month");
        }
        return recurrence;
    }

    private static String normalizeCategory(String category) {
        return category == null || category.isBlank() ? null : category.trim();
    }

    /**
     * Keeps a start date only for one-time and daily tasks, and only when it lies after the
     * creation day.
     */
    private static LocalDate normalizeStartDate(RecurrenceRule rule, LocalDate startDate, LocalDate createdOn) {
        if (startDate == null) {
            return null;
        }
        if (rule.getType() == RecurrenceType.WEEKLY || rule.getType() == RecurrenceType.MONTHLY) {
            return null;
        }
        if (createdOn != null && !startDate.isAfter(createdOn)) {
            logger.debug("Dropping start date {} not after creation day {}", startDate, createdOn);
            return null;
        }
        return startDate;
    }
}
