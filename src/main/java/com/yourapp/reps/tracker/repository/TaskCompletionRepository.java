package com.yourapp.reps.tracker.repository;

import com.yourapp.reps.tracker.model.TaskCompletion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface TaskCompletionRepository extends JpaRepository<TaskCompletion, Long> {

    // Every completion with its task, newest occurrence first
    @Query("SELECT c FROM TaskCompletion c LEFT JOIN FETCH c.task " +
           "ORDER BY c.occurrenceDate DESC, c.completedAt DESC")
    List<TaskCompletion> findAllWithTaskNewestFirst();

    @Query("SELECT c FROM TaskCompletion c LEFT JOIN FETCH c.task " +
           "WHERE c.occurrenceDate = :day ORDER BY c.completedAt DESC")
    List<TaskCompletion> findByOccurrenceDate(@Param("day") LocalDate day);

}
