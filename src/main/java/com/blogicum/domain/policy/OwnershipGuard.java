package com.blogicum.domain.policy;

import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;

/**
 * Only the author of a post or comment may change or delete it.
 */
public final class OwnershipGuard {

    private OwnershipGuard() {}

    public static boolean canMutate(User actingUser, UserId resourceAuthorId) {
        return actingUser != null && actingUser.id().isAuthor(resourceAuthorId);
    }
}
