package com.blogicum.domain.model;

import com.blogicum.domain.error.ValidationError.PostError;

import java.time.Instant;
import java.util.UUID;

public record Post(
    UUID id,
    String title,
    String text,
    UserId authorId,
    UUID categoryId,
    Instant pubDate,
    boolean published,
    Instant createdAt
) {
    public static final int MAX_TITLE_LENGTH = 256;

    /**
     * Creates a Post, returning a Result for expected validation failures.
     * Existence of the referenced category is checked by the caller.
     */
    public static Result<Post, PostError> create(UUID id, UserId authorId, PostDraft draft, Instant now) {
        return validate(draft).map(valid -> new Post(
            id,
            valid.title().trim(),
            valid.text().trim(),
            authorId,
            valid.categoryId(),
            valid.pubDate(),
            valid.publishedOrDefault(),
            now
        ));
    }

    /**
     * Applies an edit. The author is re-stamped with the editor, who has already passed
     * the ownership check and is therefore the same user.
     */
    public Result<Post, PostError> revise(UserId editorId, PostDraft draft) {
        return validate(draft).map(valid -> new Post(
            id,
            valid.title().trim(),
            valid.text().trim(),
            editorId,
            valid.categoryId(),
            valid.pubDate(),
            valid.publishedOrDefault(),
            createdAt
        ));
    }

    private static Result<PostDraft, PostError> validate(PostDraft draft) {
        if (draft.title() == null || draft.title().isBlank()) {
            return Result.failure(PostError.EmptyTitle.INSTANCE);
        }
        int titleLength = draft.title().trim().length();
        if (titleLength > MAX_TITLE_LENGTH) {
            return Result.failure(new PostError.TitleTooLong(titleLength, MAX_TITLE_LENGTH));
        }
        if (draft.text() == null || draft.text().isBlank()) {
            return Result.failure(PostError.EmptyText.INSTANCE);
        }
        if (draft.pubDate() == null) {
            return Result.failure(PostError.MissingPubDate.INSTANCE);
        }
        return Result.success(draft);
    }
}
