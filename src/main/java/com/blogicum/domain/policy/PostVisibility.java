package com.blogicum.domain.policy;

import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Post;

import java.time.Instant;

/**
 * What an anonymous reader may see.
 *
 * <p>A post is publicly visible when it is published, its publication date is not in the future
 * and it is either uncategorised or filed under a published category. {@code now} is supplied by
 * the caller on every request; unpublishing a category hides its posts from the next request on.
 */
public final class PostVisibility {

    private PostVisibility() {}

    /**
     * @param category the post's category, or {@code null} when the post has none
     */
    public static boolean isPubliclyVisible(Post post, Category category, Instant now) {
        if (!post.published() || post.pubDate().isAfter(now)) {
            return false;
        }
        if (post.categoryId() == null) {
            return true;
        }
        if (category == null || !category.id().equals(post.categoryId())) {
            throw new IllegalArgumentException("Category " + (category == null ? null : category.id())
                + " does not belong to post " + post.id());
        }
        return isCategoryVisible(category);
    }

    public static boolean isCategoryVisible(Category category) {
        return category.published();
    }
}
