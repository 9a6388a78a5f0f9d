package com.blogicum.domain.model;

public record CommentView(
    Comment comment,
    Author author
) {}
