package com.blogicum.domain.model;

/**
 * A page number resolved against the size of the result set.
 */
public record PageWindow(
    int number,
    int size,
    long totalItems,
    int totalPages
) {
    public long offset() {
        return (long) (number - 1) * size;
    }
}
