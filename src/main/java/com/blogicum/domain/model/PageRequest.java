package com.blogicum.domain.model;

import com.blogicum.domain.error.BlogError;

/**
 * Requested page of a feed: either a 1-based number or the last page.
 *
 * <p>Pagination is strict. A number below 1, a number past the last page and a token that is
 * neither a number nor {@value #LAST} all resolve to {@link BlogError.PageNotFound}. The first
 * page of an empty result set is valid and empty.
 */
public record PageRequest(int number, boolean last) {

    public static final String LAST = "last";

    public static PageRequest first() {
        return new PageRequest(1, false);
    }

    public static PageRequest of(int number) {
        return new PageRequest(number, false);
    }

    public static PageRequest lastPage() {
        return new PageRequest(0, true);
    }

    /**
     * Parses the {@code page} query parameter. Missing or blank means the first page.
     */
    public static Result<PageRequest, BlogError> parse(String token) {
        if (token == null || token.isBlank()) {
            return Result.success(first());
        }
        String trimmed = token.trim();
        if (LAST.equals(trimmed)) {
            return Result.success(lastPage());
        }
        try {
            return Result.success(of(Integer.parseInt(trimmed)));
        } catch (NumberFormatException e) {
            return Result.failure(new BlogError.PageNotFound(trimmed));
        }
    }

    public Result<PageWindow, BlogError> resolve(long totalItems, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        int totalPages = (int) Math.max(1, (totalItems + pageSize - 1) / pageSize);
        int resolved = last ? totalPages : number;
        if (resolved < 1 || resolved > totalPages) {
            return Result.failure(new BlogError.PageNotFound(String.valueOf(resolved)));
        }
        return Result.success(new PageWindow(resolved, pageSize, totalItems, totalPages));
    }

    @Override
    public String toString() {
        return last ? LAST : String.valueOf(number);
    }
}
