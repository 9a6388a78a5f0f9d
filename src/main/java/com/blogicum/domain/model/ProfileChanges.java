package com.blogicum.domain.model;

/**
 * Editable profile fields of a {@link User}.
 */
public record ProfileChanges(
    String username,
    String firstName,
    String lastName,
    String email
) {}
