package com.blogicum.domain.model;

import java.util.List;
import java.util.UUID;

/**
 * An empty input form for the rendering layer: where to submit it and which fields it has.
 */
public record FormDescriptor(
    Location action,
    List<String> fields
) {
    public static FormDescriptor comment(UUID postId) {
        return new FormDescriptor(Location.comments(postId), List.of("text"));
    }
}
