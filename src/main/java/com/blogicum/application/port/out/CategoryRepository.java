package com.blogicum.application.port.out;

import com.blogicum.domain.model.Category;

import java.util.Optional;
import java.util.UUID;

public interface CategoryRepository {
    void save(Category category);
    void update(Category category);
    Optional<Category> findById(UUID id);
    Optional<Category> findBySlug(String slug);
    boolean exists(UUID id);
    boolean existsBySlug(String slug);
    long count();
    void deleteAll();
}
