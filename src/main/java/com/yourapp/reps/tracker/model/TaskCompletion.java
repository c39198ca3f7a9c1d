package com.yourapp.reps.tracker.model;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One completed occurrence of a task. The occurrence date is the calendar day the
 * completion satisfies; at most one completion per task and day.
 */
@Entity
@Table(name = "task_completion",
        uniqueConstraints = @UniqueConstraint(name = "uk_completion_task_day",
                columnNames = {"task_id", "occurrence_date"}))
public class TaskCompletion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    @Column(name = "completed_at", nullable = false)
    private LocalDateTime completedAt;

    @Column(name = "occurrence_date", nullable = false)
    private LocalDate occurrenceDate;

    public TaskCompletion() {
    }

    public TaskCompletion(Task task, LocalDateTime completedAt, LocalDate occurrenceDate) {
        this.task = task;
        this.completedAt = completedAt;
        this.occurrenceDate = occurrenceDate;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Task getTask() {
        return task;
    }

    public void setTask(Task task) {
        this.task = task;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }

    /**
     * Day this completion counts for. Older rows without one fall back to the day of
     * {@link #getCompletedAt()}.
     */
    public LocalDate getOccurrenceDate() {
        if (occurrenceDate == null && completedAt != null) {
            return completedAt.toLocalDate();
        }
        return occurrenceDate;
    }

    public void setOccurrenceDate(LocalDate occurrenceDate) {
        this.occurrenceDate = occurrenceDate;
    }

    @Override
    public String toString() {
        return "TaskCompletion{" +
                "id=" + id +
                ", task=" + (task != null ? task.getId() : "null") +
                ", completedAt=" + completedAt +
                ", occurrenceDate=" + occurrenceDate +
                '}';
    }
}
