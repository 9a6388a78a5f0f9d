package com.blogicum.domain.model;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of an operation that either succeeds with a value or fails with an expected error.
 * Business failures (missing resources, rejected input) travel as values; exceptions are
 * reserved for faults.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }

        @Override
        public <U> Result<U, E> map(Function<T, U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
            return mapper.apply(value);
        }
        @Override
        @SuppressWarnings("unchecked")
        public <F> Result<T, F> mapError(Function<E, F> mapper) {
            return (Result<T, F>) this;
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("Cannot get value from Failure: " + error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Result<U, E> map(Function<T, U> mapper) {
            return (Result<U, E>) this;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
            return (Result<U, E>) this;
        }
        @Override
        public <F> Result<T, F> mapError(Function<E, F> mapper) {
            return new Failure<>(mapper.apply(error));
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    T getOrThrow();

    E errorOrNull();

    <U> Result<U, E> map(Function<T, U> mapper);

    <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper);

    <F> Result<T, F> mapError(Function<E, F> mapper);

    /**
     * Re-types a failure so it can be returned from an operation with a different success type.
     */
    @SuppressWarnings("unchecked")
    default <U> Result<U, E> castFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot re-type a Success");
        }
        return (Result<U, E>) this;
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    /**
     * Lifts a repository lookup: present becomes success, empty becomes the supplied error.
     */
    static <T, E> Result<T, E> fromOptional(Optional<T> value, Supplier<E> onEmpty) {
        return value.<Result<T, E>>map(Result::success).orElseGet(() -> failure(onEmpty.get()));
    }
}
