package com.blogicum.adapter.in.web;

import com.blogicum.domain.model.Page;

import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(
    List<T> data,
    Pagination pagination
) {
    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        List<T> data = page.data().stream().map(mapper).toList();
        Pagination pagination = new Pagination(
            page.number(),
            page.size(),
            page.totalItems(),
            page.totalPages(),
            page.hasNext(),
            page.hasPrevious()
        );
        return new PageResponse<>(data, pagination);
    }

    public record Pagination(
        int page,
        int pageSize,
        long totalItems,
        int totalPages,
        boolean hasNext,
        boolean hasPrevious
    ) {}
}
