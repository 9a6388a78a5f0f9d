package com.blogicum.admin.application.port.out;

/**
 * Port for admin reads across all tables.
 * Keeps the admin module from depending on each repository for statistics.
 */
public interface AdminDataPort {

    /**
     * Returns counts of all entities in the system.
     */
    DataCounts getCounts();

    record DataCounts(
        long users,
        long categories,
        long posts,
        long comments
    ) {}
}
