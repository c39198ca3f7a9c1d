package com.yourapp.reps.tracker.model;

import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "task")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_type", nullable = false)
    private RecurrenceType recurrenceType = RecurrenceType.NONE;

    // for WEEKLY recurrence
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_weekday", joinColumns = @JoinColumn(name = "task_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "weekday")
    private Set<DayOfWeek> weekdays = new HashSet<>();

    // 1-31 for MONTHLY recurrence
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_month_day", joinColumns = @JoinColumn(name = "task_id"))
    @Column(name = "month_day")
    private Set<Integer> monthDays = new HashSet<>();

    // NONE and DAILY only
    @Column(name = "start_date")
    private LocalDate startDate;

    private boolean active = true;

    @Column(name = "sort_order")
    private int sortOrder;

    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<TaskCompletion> completions = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Task() {
    }

    public Task(String title, String category, RecurrenceRule rule) {
        this.title = title;
        this.category = category;
        setRecurrenceRule(rule);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public RecurrenceType getRecurrenceType() {
        return recurrenceType != null ? recurrenceType : RecurrenceType.NONE;
    }

    public void setRecurrenceType(RecurrenceType recurrenceType) {
        this.recurrenceType = recurrenceType != null ? recurrenceType : RecurrenceType.NONE;
    }

    public Set<DayOfWeek> getWeekdays() {
        if (weekdays == null) {
            weekdays = new HashSet<>();
        }
        return weekdays;
    }

    public void setWeekdays(Set<DayOfWeek> weekdays) {
        this.weekdays = weekdays != null ? new HashSet<>(weekdays) : new HashSet<>();
    }

    public Set<Integer> getMonthDays() {
        if (monthDays == null) {
            monthDays = new HashSet<>();
        }
        return monthDays;
    }

    public void setMonthDays(Set<Integer> monthDays) {
        this.monthDays = monthDays != null ? new HashSet<>(monthDays) : new HashSet<>();
    }

    @Transient
    public RecurrenceRule getRecurrenceRule() {
        return RecurrenceRule.of(getRecurrenceType(), getWeekdays(), getMonthDays());
    }

    public void setRecurrenceRule(RecurrenceRule rule) {
        RecurrenceRule value = rule != null ? rule : RecurrenceRule.none();
        this.recurrenceType = value.getType();
        getWeekdays().clear();
        getWeekdays().addAll(value.getWeekdays());
        getMonthDays().clear();
        getMonthDays().addAll(value.getMonthDays());
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public List<TaskCompletion> getCompletions() {
        if (completions == null) {
            completions = new ArrayList<>();
        }
        return completions;
    }

    public void setCompletions(List<TaskCompletion> completions) {
        this.completions = completions;
    }

    public void addCompletion(TaskCompletion completion) {
        getCompletions().add(completion);
        completion.setTask(this);
    }

    public void removeCompletion(TaskCompletion completion) {
        getCompletions().remove(completion);
        completion.setTask(null);
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Task{" +
                "id=" + id +
                ", title='" + title + '\'' +
                ", category='" + category + '\'' +
                ", rule=" + getRecurrenceRule() +
                ", startDate=" + startDate +
                ", active=" + active +
                '}';
    }
}
