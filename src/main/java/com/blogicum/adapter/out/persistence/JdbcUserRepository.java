package com.blogicum.adapter.out.persistence;

import com.blogicum.application.port.out.UserRepository;
import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
        UserId.of(rs.getObject("id", UUID.class)),
        rs.getString("username"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("email"),
        rs.getBoolean("is_staff"),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean save(User user) {
        int inserted = jdbc.update("""
            INSERT INTO users (id, username, first_name, last_name, email, is_staff, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (username) DO NOTHING
            """,
            user.id().value(),
            user.username(),
            user.firstName(),
            user.lastName(),
            user.email(),
            user.staff(),
            Timestamp.from(user.createdAt())
        );
        return inserted == 1;
    }

    @Override
    public boolean update(User user) {
        try {
            jdbc.update("""
                UPDATE users
                SET username = ?, first_name = ?, last_name = ?, email = ?
                WHERE id = ?
                """,
                user.username(),
                user.firstName(),
                user.lastName(),
                user.email(),
                user.id().value()
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public Optional<User> findById(UserId id) {
        return jdbc.query(
            "SELECT id, username, first_name, last_name, email, is_staff, created_at FROM users WHERE id = ?",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return jdbc.query(
            "SELECT id, username, first_name, last_name, email, is_staff, created_at FROM users WHERE username = ?",
            ROW_MAPPER,
            username
        ).stream().findFirst();
    }

    @Override
    public boolean existsByUsername(String username) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE username = ?",
            Integer.class,
            username
        );
        return count != null && count > 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM users");
    }
}
