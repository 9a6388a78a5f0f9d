package com.blogicum.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Author-supplied fields of a post. {@code categoryId} is optional; {@code published}
 * defaults to {@code true} when absent.
 */
public record PostDraft(
    String title,
    String text,
    Instant pubDate,
    UUID categoryId,
    Boolean published
) {
    public boolean publishedOrDefault() {
        return published == null || published;
    }
}
