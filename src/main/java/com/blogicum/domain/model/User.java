package com.blogicum.domain.model;

import com.blogicum.domain.error.ValidationError.UserError;

import java.time.Instant;
import java.util.regex.Pattern;

public record User(
    UserId id,
    String username,
    String firstName,
    String lastName,
    String email,
    boolean staff,
    Instant createdAt
) {
    public static final int MAX_USERNAME_LENGTH = 150;

    private static final Pattern USERNAME = Pattern.compile("^[\\w.@+-]+$");

    /**
     * Creates a regular (non-staff) user, returning a Result for expected validation failures.
     * Uniqueness of the username is checked by the caller against the repository.
     */
    public static Result<User, UserError> register(
            UserId id, String username, String firstName, String lastName, String email, Instant now) {
        return validateUsername(username)
            .map(valid -> new User(id, valid, blankToEmpty(firstName), blankToEmpty(lastName),
                blankToEmpty(email), false, now));
    }

    /**
     * Returns a copy with the editable profile fields replaced.
     */
    public Result<User, UserError> withProfile(ProfileChanges changes) {
        return validateUsername(changes.username())
            .map(valid -> new User(id, valid, blankToEmpty(changes.firstName()),
                blankToEmpty(changes.lastName()), blankToEmpty(changes.email()), staff, createdAt));
    }

    private static Result<String, UserError> validateUsername(String username) {
        if (username == null || username.isBlank()) {
            return Result.failure(UserError.EmptyUsername.INSTANCE);
        }
        String trimmed = username.trim();
        if (trimmed.length() > MAX_USERNAME_LENGTH || !USERNAME.matcher(trimmed).matches()) {
            return Result.failure(new UserError.InvalidUsername(trimmed));
        }
        return Result.success(trimmed);
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
