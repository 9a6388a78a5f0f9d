package com.blogicum.domain.model;

import com.blogicum.domain.error.ValidationError.CommentError;

import java.time.Instant;
import java.util.UUID;

public record Comment(
    UUID id,
    String text,
    UserId authorId,
    UUID postId,
    Instant createdAt
) {
    public static Result<Comment, CommentError> create(UUID id, UserId authorId, UUID postId, String text, Instant now) {
        if (text == null || text.isBlank()) {
            return Result.failure(CommentError.EmptyText.INSTANCE);
        }
        return Result.success(new Comment(id, text.trim(), authorId, postId, now));
    }

    public Result<Comment, CommentError> withText(String newText) {
        if (newText == null || newText.isBlank()) {
            return Result.failure(CommentError.EmptyText.INSTANCE);
        }
        return Result.success(new Comment(id, newText.trim(), authorId, postId, createdAt));
    }
}
