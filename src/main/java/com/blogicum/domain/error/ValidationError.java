package com.blogicum.domain.error;

import java.util.UUID;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be a valid UUID format: " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }
    }

    // User (registration and profile) errors
    sealed interface UserError extends ValidationError {

        record EmptyUsername() implements UserError {
            public static final EmptyUsername INSTANCE = new EmptyUsername();
            @Override
            public String message() {
                return "Username cannot be empty";
            }

            @Override
            public String code() {
                return "USERNAME_EMPTY";
            }
        }

        record InvalidUsername(String username) implements UserError {
            @Override
            public String message() {
                return "Username may contain at most 150 letters, digits and @/./+/-/_ characters: " + username;
            }

            @Override
            public String code() {
                return "USERNAME_INVALID";
            }
        }

        record UsernameTaken(String username) implements UserError {
            @Override
            public String message() {
                return "Username is already taken: " + username;
            }

            @Override
            public String code() {
                return "USERNAME_TAKEN";
            }
        }
    }

    // Post errors
    sealed interface PostError extends ValidationError {

        record EmptyTitle() implements PostError {
            public static final EmptyTitle INSTANCE = new EmptyTitle();
            @Override
            public String message() {
                return "Post title cannot be empty";
            }

            @Override
            public String code() {
                return "POST_TITLE_EMPTY";
            }
        }

        record TitleTooLong(int length, int maxLength) implements PostError {
            @Override
            public String message() {
                return "Post title exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_TITLE_TOO_LONG";
            }
        }

        record EmptyText() implements PostError {
            public static final EmptyText INSTANCE = new EmptyText();
            @Override
            public String message() {
                return "Post text cannot be empty";
            }

            @Override
            public String code() {
                return "POST_TEXT_EMPTY";
            }
        }

        record MissingPubDate() implements PostError {
            public static final MissingPubDate INSTANCE = new MissingPubDate();
            @Override
            public String message() {
                return "Post publication date is required";
            }

            @Override
            public String code() {
                return "POST_PUB_DATE_MISSING";
            }
        }

        record UnknownCategory(UUID categoryId) implements PostError {
            @Override
            public String message() {
                return "Category does not exist: " + categoryId;
            }

            @Override
            public String code() {
                return "POST_CATEGORY_UNKNOWN";
            }
        }
    }

    // Comment errors
    sealed interface CommentError extends ValidationError {

        record EmptyText() implements CommentError {
            public static final EmptyText INSTANCE = new EmptyText();
            @Override
            public String message() {
                return "Comment text cannot be empty";
            }

            @Override
            public String code() {
                return "COMMENT_TEXT_EMPTY";
            }
        }
    }

    // Category errors
    sealed interface CategoryError extends ValidationError {

        record EmptyTitle() implements CategoryError {
            public static final EmptyTitle INSTANCE = new EmptyTitle();
            @Override
            public String message() {
                return "Category title cannot be empty";
            }

            @Override
            public String code() {
                return "CATEGORY_TITLE_EMPTY";
            }
        }

        record TitleTooLong(int length, int maxLength) implements CategoryError {
            @Override
            public String message() {
                return "Category title exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "CATEGORY_TITLE_TOO_LONG";
            }
        }

        record InvalidSlug(String slug) implements CategoryError {
            @Override
            public String message() {
                return "Slug may contain only latin letters, digits, hyphens and underscores: " + slug;
            }

            @Override
            public String code() {
                return "CATEGORY_SLUG_INVALID";
            }
        }

        record SlugTaken(String slug) implements CategoryError {
            @Override
            public String message() {
                return "Category slug is already in use: " + slug;
            }

            @Override
            public String code() {
                return "CATEGORY_SLUG_TAKEN";
            }
        }
    }
}
