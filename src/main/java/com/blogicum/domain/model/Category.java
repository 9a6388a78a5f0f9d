package com.blogicum.domain.model;

import com.blogicum.domain.error.ValidationError.CategoryError;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

public record Category(
    UUID id,
    String title,
    String description,
    String slug,
    boolean published,
    Instant createdAt
) {
    public static final int MAX_TITLE_LENGTH = 256;
    public static final int MAX_SLUG_LENGTH = 64;

    private static final Pattern SLUG = Pattern.compile("^[-a-zA-Z0-9_]+$");

    public static Result<Category, CategoryError> create(
            UUID id, String title, String description, String slug, boolean published, Instant now) {
        if (title == null || title.isBlank()) {
            return Result.failure(CategoryError.EmptyTitle.INSTANCE);
        }
        String trimmedTitle = title.trim();
        if (trimmedTitle.length() > MAX_TITLE_LENGTH) {
            return Result.failure(new CategoryError.TitleTooLong(trimmedTitle.length(), MAX_TITLE_LENGTH));
        }
        if (slug == null || slug.length() > MAX_SLUG_LENGTH || !SLUG.matcher(slug).matches()) {
            return Result.failure(new CategoryError.InvalidSlug(slug));
        }
        return Result.success(new Category(
            id, trimmedTitle, description == null ? "" : description.trim(), slug, published, now));
    }

    public Category withPublished(boolean published) {
        return new Category(id, title, description, slug, published, createdAt);
    }
}
