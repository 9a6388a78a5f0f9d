package com.blogicum.application.service;

import com.blogicum.application.port.in.CreatePostUseCase;
import com.blogicum.application.port.in.DeletePostUseCase;
import com.blogicum.application.port.in.UpdatePostUseCase;
import com.blogicum.application.port.out.CategoryRepository;
import com.blogicum.application.port.out.IdGenerator;
import com.blogicum.application.port.out.MetricsPort;
import com.blogicum.application.port.out.PostRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.error.ValidationError.PostError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Location;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostDraft;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;
import com.blogicum.domain.policy.OwnershipGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
public class PostService implements CreatePostUseCase, UpdatePostUseCase, DeletePostUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostRepository postRepository;
    private final CategoryRepository categoryRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final MetricsPort metrics;

    public PostService(
            PostRepository postRepository,
            CategoryRepository categoryRepository,
            IdGenerator idGenerator,
            Clock clock,
            MetricsPort metrics) {
        this.postRepository = postRepository;
        this.categoryRepository = categoryRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Mutation<Post>, BlogError> createPost(Actor actor, PostDraft draft) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous post creation rejected");
            return acting.castFailure();
        }
        User user = acting.getOrThrow();
        log.debug("Creating post for user={}", user.id());

        var categoryCheck = checkCategory(draft);
        if (categoryCheck.isFailure()) {
            return categoryCheck.castFailure();
        }

        var postResult = Post.create(idGenerator.generate(), user.id(), draft, Instant.now(clock));
        if (postResult.isFailure()) {
            log.warn("Post validation failed for user={}: {}", user.id(), postResult.errorOrNull().message());
            return postResult.mapError(BlogError::invalid).castFailure();
        }

        Post post = postResult.getOrThrow();
        postRepository.save(post);

        metrics.incrementMutations(MetricsPort.Resource.POST, MetricsPort.Action.CREATED);
        log.info("Post created: postId={}, author={}", post.id(), user.username());

        return Result.success(Mutation.applied(post, Location.profile(user.username())));
    }

    @Override
    @Transactional
    public Result<Mutation<Post>, BlogError> updatePost(Actor actor, UUID postId, PostDraft draft) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous post update rejected: postId={}", postId);
            return acting.castFailure();
        }
        User user = acting.getOrThrow();

        var existing = postRepository.findById(postId);
        if (existing.isEmpty()) {
            return Result.failure(new BlogError.PostNotFound(postId));
        }

        Post post = existing.get();
        if (!OwnershipGuard.canMutate(user, post.authorId())) {
            log.warn("User {} may not edit post {} of {}, redirecting to detail", user.id(), postId, post.authorId());
            metrics.incrementOwnershipRedirects(MetricsPort.Resource.POST);
            return Result.success(Mutation.redirected(Location.postDetail(postId)));
        }

        var categoryCheck = checkCategory(draft);
        if (categoryCheck.isFailure()) {
            return categoryCheck.castFailure();
        }

        var revised = post.revise(user.id(), draft);
        if (revised.isFailure()) {
            log.warn("Post validation failed: postId={}: {}", postId, revised.errorOrNull().message());
            return revised.mapError(BlogError::invalid).castFailure();
        }

        postRepository.update(revised.getOrThrow());

        metrics.incrementMutations(MetricsPort.Resource.POST, MetricsPort.Action.UPDATED);
        log.info("Post updated: postId={}", postId);

        return Result.success(Mutation.applied(revised.getOrThrow(), Location.postDetail(postId)));
    }

    @Override
    @Transactional
    public Result<Mutation<Void>, BlogError> deletePost(Actor actor, UUID postId) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous post deletion rejected: postId={}", postId);
            return acting.castFailure();
        }
        User user = acting.getOrThrow();

        var existing = postRepository.findById(postId);
        if (existing.isEmpty()) {
            return Result.failure(new BlogError.PostNotFound(postId));
        }

        if (!OwnershipGuard.canMutate(user, existing.get().authorId())) {
            log.warn("User {} may not delete post {}, redirecting to detail", user.id(), postId);
            metrics.incrementOwnershipRedirects(MetricsPort.Resource.POST);
            return Result.success(Mutation.redirected(Location.postDetail(postId)));
        }

        postRepository.delete(postId);

        metrics.incrementMutations(MetricsPort.Resource.POST, MetricsPort.Action.DELETED);
        log.info("Post deleted: postId={}", postId);

        return Result.success(Mutation.applied(null, Location.profile(user.username())));
    }

    private Result<Void, BlogError> checkCategory(PostDraft draft) {
        UUID categoryId = draft.categoryId();
        if (categoryId != null && !categoryRepository.exists(categoryId)) {
            log.warn("Post refers to unknown category {}", categoryId);
            return Result.failure(BlogError.invalid(new PostError.UnknownCategory(categoryId)));
        }
        return Result.success(null);
    }
}
