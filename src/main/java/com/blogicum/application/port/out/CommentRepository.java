package com.blogicum.application.port.out;

import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.CommentView;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CommentRepository {
    void save(Comment comment);
    void update(Comment comment);
    void delete(UUID id);
    Optional<Comment> findById(UUID id);

    /**
     * Comments of a post with their authors, oldest first.
     */
    List<CommentView> findByPostId(UUID postId);

    long count();
    void deleteAll();
}
