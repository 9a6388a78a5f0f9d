package com.blogicum.application.port.out;

import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostSummary;
import com.blogicum.domain.policy.PostFilter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PostRepository {
    void save(Post post);
    void update(Post post);

    /**
     * Deletes the post together with its comments.
     */
    void delete(UUID id);

    Optional<Post> findById(UUID id);

    /**
     * Loads a post with its author, category and live comment count, regardless of publication state.
     */
    Optional<PostSummary> findSummaryById(UUID id);

    long countMatching(PostFilter filter);

    /**
     * Posts matching the filter, newest publication date first, ties broken by title.
     */
    List<PostSummary> findMatching(PostFilter filter, long offset, int limit);

    long count();
    void deleteAll();
}
