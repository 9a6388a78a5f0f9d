package com.blogicum.domain.model;

import com.blogicum.domain.error.ValidationError.UserIdError;

import java.util.UUID;

/**
 * Identity of a blog account. It arrives from clients in the {@code X-User-Id} header,
 * is stamped on every post and comment as the author, and is what the ownership rule compares.
 */
public record UserId(UUID value) {

    public UserId {
        if (value == null) {
            throw new IllegalStateException("UserId value cannot be null - use parse() for client input");
        }
    }

    /**
     * Parses the identity a client sent. Surrounding whitespace is ignored; anything else that is
     * not a UUID is rejected as a value, so the caller can answer 400.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        try {
            return Result.success(new UserId(UUID.fromString(value.trim())));
        } catch (IllegalArgumentException e) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
    }

    /**
     * Wraps an id generated by us or read back from the users table.
     */
    public static UserId of(UUID value) {
        return new UserId(value);
    }

    public static UserId random() {
        return new UserId(UUID.randomUUID());
    }

    /**
     * True when this account is the one stamped as {@code authorId} on a post or comment.
     */
    public boolean isAuthor(UserId authorId) {
        return value.equals(authorId == null ? null : authorId.value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
