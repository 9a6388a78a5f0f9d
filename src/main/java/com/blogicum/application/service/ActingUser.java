package com.blogicum.application.service;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;

/**
 * Login-required check shared by the write operations. Runs before any lookup.
 */
final class ActingUser {

    private ActingUser() {}

    static Result<User, BlogError> require(Actor actor) {
        return Result.fromOptional(actor.user(), () -> BlogError.AuthenticationRequired.INSTANCE);
    }
}
