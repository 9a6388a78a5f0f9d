package com.blogicum.domain.model;

public record CategoryFeed(
    Category category,
    Page<PostSummary> posts
) {}
