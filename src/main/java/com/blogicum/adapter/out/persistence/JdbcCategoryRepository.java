package com.blogicum.adapter.out.persistence;

import com.blogicum.application.port.out.CategoryRepository;
import com.blogicum.domain.model.Category;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcCategoryRepository implements CategoryRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Category> ROW_MAPPER = (rs, rowNum) -> new Category(
        rs.getObject("id", UUID.class),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("slug"),
        rs.getBoolean("is_published"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcCategoryRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Category category) {
        jdbc.update("""
            INSERT INTO categories (id, title, description, slug, is_published, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            category.id(),
            category.title(),
            category.description(),
            category.slug(),
            category.published(),
            Timestamp.from(category.createdAt())
        );
    }

    @Override
    public void update(Category category) {
        jdbc.update("""
            UPDATE categories
            SET title = ?, description = ?, slug = ?, is_published = ?
            WHERE id = ?
            """,
            category.title(),
            category.description(),
            category.slug(),
            category.published(),
            category.id()
        );
    }

    @Override
    public Optional<Category> findById(UUID id) {
        return jdbc.query(
            "SELECT id, title, description, slug, is_published, created_at FROM categories WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public Optional<Category> findBySlug(String slug) {
        return jdbc.query(
            "SELECT id, title, description, slug, is_published, created_at FROM categories WHERE slug = ?",
            ROW_MAPPER,
            slug
        ).stream().findFirst();
    }

    @Override
    public boolean exists(UUID id) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM categories WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    @Override
    public boolean existsBySlug(String slug) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM categories WHERE slug = ?", Integer.class, slug);
        return count != null && count > 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM categories", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM categories");
    }
}
