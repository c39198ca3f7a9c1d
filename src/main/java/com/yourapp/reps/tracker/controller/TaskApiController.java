package com.yourapp.reps.tracker.controller;

import com.yourapp.reps.tracker.controller.dto.CategoryDto;
import com.yourapp.reps.tracker.controller.dto.HistoryDayDto;
import com.yourapp.reps.tracker.controller.dto.MonthlyTrendDto;
import com.yourapp.reps.tracker.controller.dto.ReorderRequestDto;
import com.yourapp.reps.tracker.controller.dto.StatsSummaryDto;
import com.yourapp.reps.tracker.controller.dto.TaskRequestDto;
import com.yourapp.reps.tracker.controller.dto.TaskResponseDto;
import com.yourapp.reps.tracker.controller.dto.ToggleResponseDto;
import com.yourapp.reps.tracker.controller.dto.WeekdayCountDto;
import com.yourapp.reps.tracker.model.Category;
import com.yourapp.reps.tracker.model.Task;
import com.yourapp.reps.tracker.model.YearSummary;
import com.yourapp.reps.tracker.service.CalendarDays;
import com.yourapp.reps.tracker.service.TaskHistoryService;
import com.yourapp.reps.tracker.service.TaskService;
import com.yourapp.reps.tracker.service.TaskStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TaskApiController {

    private final TaskService taskService;
    private final TaskStatsService statsService;
    private final TaskHistoryService historyService;
    private final TaskDtoMapper mapper;
    private final CalendarDays calendarDays;

    @GetMapping("/tasks")
    public List<TaskResponseDto> getTasks() {
        return toDtos(taskService.getActiveTasks());
    }

    @GetMapping("/tasks/today")
    public List<TaskResponseDto> getTodayTasks() {
        return toDtos(taskService.getTodayTasks());
    }

    @GetMapping("/tasks/{id}")
    public TaskResponseDto getTask(@PathVariable Long id) {
        return toDto(taskService.getTask(id));
    }

    @PostMapping("/tasks")
    public ResponseEntity<TaskResponseDto> createTask(@RequestBody TaskRequestDto request) {
        Task task = taskService.createTask(request.title(), request.category(),
                mapper.toRule(request), request.startDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(task));
    }

    @PutMapping("/tasks/{id}")
    public TaskResponseDto updateTask(@PathVariable Long id, @RequestBody TaskRequestDto request) {
        Task task = taskService.updateTask(id, request.title(), request.category(),
                mapper.toRule(request), request.startDate());
        return toDto(task);
    }

    @DeleteMapping("/tasks/{id}")
    public ResponseEntity<Void> deleteTask(@PathVariable Long id) {
        taskService.deleteTask(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tasks/{id}/archive")
    public ResponseEntity<Void> archiveTask(@PathVariable Long id) {
        taskService.archiveTask(id);
        return ResponseEntity.ok().build();
    }

    @PutMapping("/tasks/order")
    public ResponseEntity<Void> reorder(@RequestBody ReorderRequestDto request) {
        taskService.reorderTasks(request.taskIds());
        return ResponseEntity.ok().build();
    }

    /**
     * Toggles one occurrence day, today when {@code date} is absent.
     */
    @PostMapping("/tasks/{id}/toggle")
    public ToggleResponseDto toggle(@PathVariable Long id,
                                    @RequestParam(required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : calendarDays.today();
        boolean completed = taskService.toggleCompletion(id, day);
        return new ToggleResponseDto(id, day, completed);
    }

    @GetMapping("/stats")
    public StatsSummaryDto getStats() {
        return mapper.toDto("all", statsService.summarizeAll());
    }

    @GetMapping("/stats/categories/{name}")
    public StatsSummaryDto getCategoryStats(@PathVariable String name) {
        return mapper.toDto(name, statsService.summarizeCategory(name));
    }

    @GetMapping("/history")
    public List<HistoryDayDto> getHistory() {
        return mapper.toHistory(historyService.completionsByDay());
    }

    @GetMapping("/stats/rhythm")
    public List<WeekdayCountDto> getRhythm(@RequestParam(required = false) String category) {
        return mapper.toRhythm(historyService.weeklyRhythm(scope(category)));
    }

    @GetMapping("/stats/trend")
    public MonthlyTrendDto getTrend(@RequestParam(required = false) String category) {
        return mapper.toDto(historyService.monthlyTrend(scope(category)));
    }

    @GetMapping("/stats/year/{year}")
    public YearSummary getYear(@PathVariable int year, @RequestParam(required = false) String category) {
        return historyService.yearSummary(scope(category), year);
    }

    @GetMapping("/categories")
    public List<CategoryDto> getCategories() {
        return taskService.getCategories().stream()
                .map(mapper::toDto)
                .collect(Collectors.toList());
    }

    @PostMapping("/categories")
    public ResponseEntity<CategoryDto> createCategory(@RequestBody CategoryDto request) {
        Category category = taskService.createCategory(request.name(), request.iconName(), request.colorHex());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDto(category));
    }

    private List<Task> scope(String category) {
        return category == null || category.isBlank()
                ? taskService.getActiveTasks()
                : taskService.getTasksInCategory(category);
    }

    private TaskResponseDto toDto(Task task) {
        return mapper.toDto(task, statsService.statsFor(task));
    }

    private List<TaskResponseDto> toDtos(List<Task> tasks) {
        return tasks.stream().map(this::toDto).collect(Collectors.toList());
    }
}
