package com.blogicum.domain.model;

/**
 * Successful outcome of a write request.
 *
 * <p>{@link Applied} means the change was stored and the client continues at {@code target}.
 * {@link Redirected} means the acting user does not own the resource: nothing was changed and
 * the client is sent back to the resource's detail page. A foreign resource is not reported as
 * an error.
 */
public sealed interface Mutation<T> permits Mutation.Applied, Mutation.Redirected {

    record Applied<T>(T value, Location target) implements Mutation<T> {
        @Override
        public Location location() {
            return target;
        }
    }

    record Redirected<T>(Location location) implements Mutation<T> {}

    Location location();

    default boolean applied() {
        return this instanceof Applied;
    }

    static <T> Mutation<T> applied(T value, Location target) {
        return new Applied<>(value, target);
    }

    static <T> Mutation<T> redirected(Location location) {
        return new Redirected<>(location);
    }
}
