package com.blogicum.domain.model;

/**
 * A post as listed in feeds and on its detail page: the row itself, its author, its category
 * (null when uncategorised) and the live number of comments.
 */
public record PostSummary(
    Post post,
    Author author,
    Category category,
    long commentCount
) {}
