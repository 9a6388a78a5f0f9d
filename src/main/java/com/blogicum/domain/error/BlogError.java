package com.blogicum.domain.error;

import java.util.UUID;

/**
 * Sealed type representing expected business errors of the blog operations.
 *
 * <p>Ownership denial is deliberately absent: a user touching someone else's post or comment is
 * redirected, see {@link com.blogicum.domain.model.Mutation.Redirected}.
 */
public sealed interface BlogError {

    /**
     * A post, comment, category, user or page that does not exist (or is not published).
     */
    sealed interface NotFound extends BlogError {}

    record PostNotFound(UUID postId) implements NotFound {
        @Override
        public String message() {
            return "Post not found: " + postId;
        }

        @Override
        public String code() {
            return "POST_NOT_FOUND";
        }
    }

    record CommentNotFound(UUID commentId) implements NotFound {
        @Override
        public String message() {
            return "Comment not found: " + commentId;
        }

        @Override
        public String code() {
            return "COMMENT_NOT_FOUND";
        }
    }

    record CategoryNotFound(String slug) implements NotFound {
        @Override
        public String message() {
            return "Category not found: " + slug;
        }

        @Override
        public String code() {
            return "CATEGORY_NOT_FOUND";
        }
    }

    record UserNotFound(String username) implements NotFound {
        @Override
        public String message() {
            return "User not found: " + username;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }
    }

    record PageNotFound(String page) implements NotFound {
        @Override
        public String message() {
            return "Invalid page: " + page;
        }

        @Override
        public String code() {
            return "PAGE_NOT_FOUND";
        }
    }

    record AuthenticationRequired() implements BlogError {
        public static final AuthenticationRequired INSTANCE = new AuthenticationRequired();

        @Override
        public String message() {
            return "Authentication is required for this operation";
        }

        @Override
        public String code() {
            return "AUTHENTICATION_REQUIRED";
        }
    }

    record Forbidden(String reason) implements BlogError {
        @Override
        public String message() {
            return reason;
        }

        @Override
        public String code() {
            return "FORBIDDEN";
        }
    }

    /**
     * Wraps a domain validation error of the submitted fields.
     */
    record ValidationFailed(ValidationError error) implements BlogError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();

    static BlogError invalid(ValidationError error) {
        return new ValidationFailed(error);
    }
}
