package com.blogicum.application.port.out;

/**
 * Port for recording application metrics.
 */
public interface MetricsPort {

    enum Feed { HOME, CATEGORY, PROFILE }

    enum Resource { POST, COMMENT, PROFILE }

    enum Action { CREATED, UPDATED, DELETED }

    void incrementFeedRequests(Feed feed);

    void incrementMutations(Resource resource, Action action);

    /**
     * Counts a write attempt on a resource the acting user does not own.
     */
    void incrementOwnershipRedirects(Resource resource);

    void incrementRegistrations();
}
