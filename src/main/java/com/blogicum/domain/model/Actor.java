package com.blogicum.domain.model;

import java.util.Optional;

/**
 * The identity attached to the current request: either an authenticated user or nobody.
 */
public sealed interface Actor permits Actor.Anonymous, Actor.Authenticated {

    record Anonymous() implements Actor {
        public static final Anonymous INSTANCE = new Anonymous();

        @Override
        public Optional<User> user() {
            return Optional.empty();
        }
    }

    record Authenticated(User account) implements Actor {
        public Authenticated {
            if (account == null) {
                throw new IllegalArgumentException("Authenticated actor requires a user");
            }
        }

        @Override
        public Optional<User> user() {
            return Optional.of(account);
        }
    }

    Optional<User> user();

    static Actor anonymous() {
        return Anonymous.INSTANCE;
    }

    static Actor of(User user) {
        return new Authenticated(user);
    }
}
