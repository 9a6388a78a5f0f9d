package com.blogicum.adapter.out.persistence;

import com.blogicum.application.port.out.PostRepository;
import com.blogicum.domain.model.Author;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostSummary;
import com.blogicum.domain.model.UserId;
import com.blogicum.domain.policy.PostFilter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcPostRepository implements PostRepository {

    private final JdbcTemplate jdbc;

    private static final String POST_COLUMNS =
        "p.id, p.title, p.text, p.author_id, p.category_id, p.pub_date, p.is_published, p.created_at";

    private static final String SUMMARY_SELECT = """
        SELECT %s,
               u.username, u.first_name, u.last_name,
               c.title AS category_title, c.description AS category_description, c.slug AS category_slug,
               c.is_published AS category_is_published, c.created_at AS category_created_at,
               (SELECT COUNT(*) FROM comments cm WHERE cm.post_id = p.id) AS comment_count
        FROM posts p
        JOIN users u ON u.id = p.author_id
        LEFT JOIN categories c ON c.id = p.category_id
        """.formatted(POST_COLUMNS);

    private static final String FEED_ORDER = " ORDER BY p.pub_date DESC, p.title ASC, p.id ASC";

    private static final RowMapper<Post> ROW_MAPPER = (rs, rowNum) -> new Post(
        rs.getObject("id", UUID.class),
        rs.getString("title"),
        rs.getString("text"),
        UserId.of(rs.getObject("author_id", UUID.class)),
        rs.getObject("category_id", UUID.class),
        rs.getTimestamp("pub_date").toInstant(),
        rs.getBoolean("is_published"),
        rs.getTimestamp("created_at").toInstant()
    );

    private static final RowMapper<PostSummary> SUMMARY_MAPPER = (rs, rowNum) -> {
        Post post = ROW_MAPPER.mapRow(rs, rowNum);
        Category category = post.categoryId() == null ? null : new Category(
            post.categoryId(),
            rs.getString("category_title"),
            rs.getString("category_description"),
            rs.getString("category_slug"),
            rs.getBoolean("category_is_published"),
            rs.getTimestamp("category_created_at").toInstant()
        );
        Author author = new Author(
            post.authorId(),
            rs.getString("username"),
            rs.getString("first_name"),
            rs.getString("last_name")
        );
        return new PostSummary(post, author, category, rs.getLong("comment_count"));
    };

    public JdbcPostRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Post post) {
        jdbc.update("""
            INSERT INTO posts (id, title, text, author_id, category_id, pub_date, is_published, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            post.id(),
            post.title(),
            post.text(),
            post.authorId().value(),
            post.categoryId(),
            Timestamp.from(post.pubDate()),
            post.published(),
            Timestamp.from(post.createdAt())
        );
    }

    @Override
    public void update(Post post) {
        jdbc.update("""
            UPDATE posts
            SET title = ?, text = ?, author_id = ?, category_id = ?, pub_date = ?, is_published = ?
            WHERE id = ?
            """,
            post.title(),
            post.text(),
            post.authorId().value(),
            post.categoryId(),
            Timestamp.from(post.pubDate()),
            post.published(),
            post.id()
        );
    }

    @Override
    public void delete(UUID id) {
        // comments go with the post (ON DELETE CASCADE)
        jdbc.update("DELETE FROM posts WHERE id = ?", id);
    }

    @Override
    public Optional<Post> findById(UUID id) {
        return jdbc.query(
            "SELECT " + POST_COLUMNS + " FROM posts p WHERE p.id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public Optional<PostSummary> findSummaryById(UUID id) {
        return jdbc.query(SUMMARY_SELECT + " WHERE p.id = ?", SUMMARY_MAPPER, id)
            .stream().findFirst();
    }

    @Override
    public long countMatching(PostFilter filter) {
        Condition condition = Condition.of(filter);
        Long count = jdbc.queryForObject("""
            SELECT COUNT(*)
            FROM posts p
            LEFT JOIN categories c ON c.id = p.category_id
            """ + condition.whereClause(),
            Long.class,
            condition.params().toArray()
        );
        return count != null ? count : 0;
    }

    @Override
    public List<PostSummary> findMatching(PostFilter filter, long offset, int limit) {
        Condition condition = Condition.of(filter);
        List<Object> params = new ArrayList<>(condition.params());
        params.add(limit);
        params.add(offset);
        return jdbc.query(
            SUMMARY_SELECT + condition.whereClause() + FEED_ORDER + " LIMIT ? OFFSET ?",
            SUMMARY_MAPPER,
            params.toArray()
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM posts", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM posts");
    }

    /**
     * SQL rendering of a {@link PostFilter}. Expects {@code posts p} and {@code categories c}
     * (left-joined) in the FROM clause.
     */
    record Condition(String whereClause, List<Object> params) {

        static Condition of(PostFilter filter) {
            List<String> predicates = new ArrayList<>();
            List<Object> params = new ArrayList<>();

            if (filter.authorId() != null) {
                predicates.add("p.author_id = ?");
                params.add(filter.authorId().value());
            }
            if (filter.categoryId() != null) {
                predicates.add("p.category_id = ?");
                params.add(filter.categoryId());
            }
            if (filter.appliesVisibility()) {
                predicates.add("p.is_published = TRUE");
                predicates.add("p.pub_date <= ?");
                params.add(Timestamp.from(filter.visibleAt()));
                predicates.add("(p.category_id IS NULL OR c.is_published = TRUE)");
            }

            String where = predicates.isEmpty() ? "" : " WHERE " + String.join(" AND ", predicates);
            return new Condition(where, List.copyOf(params));
        }
    }
}
