package com.yourapp.reps.tracker.repository;

import com.yourapp.reps.tracker.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface TaskRepository extends JpaRepository<Task, Long> {

    List<Task> findByActiveTrueOrderBySortOrderAsc();

    List<Task> findByCategoryOrderBySortOrderAsc(String category);

    // -1 when empty, so the first task gets 0 like reorderTasks assigns
    @Query("SELECT COALESCE(MAX(t.sortOrder), -1) FROM Task t")
    int findMaxSortOrder();
}
