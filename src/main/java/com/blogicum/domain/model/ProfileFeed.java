package com.blogicum.domain.model;

public record ProfileFeed(
    User profile,
    Page<PostSummary> posts
) {}
