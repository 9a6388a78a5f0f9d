package com.blogicum.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * One numbered page of an ordered result set. Page numbers start at 1.
 */
public record Page<T>(
    List<T> data,
    int number,
    int size,
    long totalItems,
    int totalPages
) {
    public static <T> Page<T> of(List<T> data, PageWindow window) {
        return new Page<>(List.copyOf(data), window.number(), window.size(), window.totalItems(), window.totalPages());
    }

    public boolean hasNext() {
        return number < totalPages;
    }

    public boolean hasPrevious() {
        return number > 1;
    }

    public <U> Page<U> map(Function<T, U> mapper) {
        return new Page<>(data.stream().map(mapper).toList(), number, size, totalItems, totalPages);
    }
}
