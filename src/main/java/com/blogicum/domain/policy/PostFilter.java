package com.blogicum.domain.policy;

import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.UserId;

import java.time.Instant;
import java.util.UUID;

/**
 * Selection criteria of a post feed. Every non-null component narrows the selection;
 * {@code visibleAt} applies {@link PostVisibility} as of that instant.
 *
 * <p>The post repository translates the criteria into its query language; {@link #matches}
 * is the same predicate in memory.
 */
public record PostFilter(
    UserId authorId,
    UUID categoryId,
    Instant visibleAt
) {
    public static PostFilter publicFeed(Instant now) {
        return new PostFilter(null, null, requireNow(now));
    }

    public static PostFilter publicCategoryFeed(UUID categoryId, Instant now) {
        if (categoryId == null) {
            throw new IllegalArgumentException("categoryId is required");
        }
        return new PostFilter(null, categoryId, requireNow(now));
    }

    /**
     * All posts of an author, whatever their publication state.
     */
    public static PostFilter authorFeed(UserId authorId) {
        if (authorId == null) {
            throw new IllegalArgumentException("authorId is required");
        }
        return new PostFilter(authorId, null, null);
    }

    public boolean appliesVisibility() {
        return visibleAt != null;
    }

    public boolean matches(Post post, Category category) {
        if (authorId != null && !authorId.equals(post.authorId())) {
            return false;
        }
        if (categoryId != null && !categoryId.equals(post.categoryId())) {
            return false;
        }
        return visibleAt == null || PostVisibility.isPubliclyVisible(post, category, visibleAt);
    }

    private static Instant requireNow(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now is required for a public feed");
        }
        return now;
    }
}
