package com.blogicum.adapter.out.persistence;

import com.blogicum.application.port.out.CommentRepository;
import com.blogicum.domain.model.Author;
import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.CommentView;
import com.blogicum.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcCommentRepository implements CommentRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Comment> ROW_MAPPER = (rs, rowNum) -> new Comment(
        rs.getObject("id", UUID.class),
        rs.getString("text"),
        UserId.of(rs.getObject("author_id", UUID.class)),
        rs.getObject("post_id", UUID.class),
        rs.getTimestamp("created_at").toInstant()
    );

    private static final RowMapper<CommentView> VIEW_MAPPER = (rs, rowNum) -> {
        Comment comment = ROW_MAPPER.mapRow(rs, rowNum);
        return new CommentView(comment, new Author(
            comment.authorId(),
            rs.getString("username"),
            rs.getString("first_name"),
            rs.getString("last_name")
        ));
    };

    public JdbcCommentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Comment comment) {
        jdbc.update("""
            INSERT INTO comments (id, text, author_id, post_id, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            comment.id(),
            comment.text(),
            comment.authorId().value(),
            comment.postId(),
            Timestamp.from(comment.createdAt())
        );
    }

    @Override
    public void update(Comment comment) {
        jdbc.update("UPDATE comments SET text = ? WHERE id = ?", comment.text(), comment.id());
    }

    @Override
    public void delete(UUID id) {
        jdbc.update("DELETE FROM comments WHERE id = ?", id);
    }

    @Override
    public Optional<Comment> findById(UUID id) {
        return jdbc.query(
            "SELECT id, text, author_id, post_id, created_at FROM comments WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public List<CommentView> findByPostId(UUID postId) {
        return jdbc.query("""
            SELECT cm.id, cm.text, cm.author_id, cm.post_id, cm.created_at,
                   u.username, u.first_name, u.last_name
            FROM comments cm
            JOIN users u ON u.id = cm.author_id
            WHERE cm.post_id = ?
            ORDER BY cm.created_at ASC, cm.id ASC
            """,
            VIEW_MAPPER,
            postId
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM comments", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM comments");
    }
}
