package com.yourapp.reps.tracker.repository;

import com.yourapp.reps.tracker.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface CategoryRepository extends JpaRepository<Category, Long> {

    List<Category> findAllByOrderBySortOrderAsc();

    Optional<Category> findByNameIgnoreCase(String name);

    @Query("SELECT COALESCE(MAX(c.sortOrder), -1) FROM Category c")
    int findMaxSortOrder();
}
