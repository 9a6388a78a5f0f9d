package com.blogicum.domain.model;

/**
 * Public identity of a post or comment author, as shown next to the content.
 */
public record Author(
    UserId id,
    String username,
    String firstName,
    String lastName
) {
    public static Author of(User user) {
        return new Author(user.id(), user.username(), user.firstName(), user.lastName());
    }
}
