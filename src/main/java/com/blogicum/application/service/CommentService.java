package com.blogicum.application.service;

import com.blogicum.application.port.in.CreateCommentUseCase;
import com.blogicum.application.port.in.DeleteCommentUseCase;
import com.blogicum.application.port.in.UpdateCommentUseCase;
import com.blogicum.application.port.out.CommentRepository;
import com.blogicum.application.port.out.IdGenerator;
import com.blogicum.application.port.out.MetricsPort;
import com.blogicum.application.port.out.PostRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.Location;
import com.blogicum.domain.model.Mutation;
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

/**
 * Comments of a post. Every successful write sends the client back to the post.
 */
@Service
public class CommentService implements CreateCommentUseCase, UpdateCommentUseCase, DeleteCommentUseCase {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final MetricsPort metrics;

    public CommentService(
            CommentRepository commentRepository,
            PostRepository postRepository,
            IdGenerator idGenerator,
            Clock clock,
            MetricsPort metrics) {
        this.commentRepository = commentRepository;
        this.postRepository = postRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Mutation<Comment>, BlogError> createComment(Actor actor, UUID postId, String text) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous comment rejected: postId={}", postId);
            return acting.castFailure();
        }
        User user = acting.getOrThrow();

        if (postRepository.findById(postId).isEmpty()) {
            return Result.failure(new BlogError.PostNotFound(postId));
        }

        var commentResult = Comment.create(idGenerator.generate(), user.id(), postId, text, Instant.now(clock));
        if (commentResult.isFailure()) {
            log.warn("Comment validation failed on post {}: {}", postId, commentResult.errorOrNull().message());
            return commentResult.mapError(BlogError::invalid).castFailure();
        }

        Comment comment = commentResult.getOrThrow();
        commentRepository.save(comment);

        metrics.incrementMutations(MetricsPort.Resource.COMMENT, MetricsPort.Action.CREATED);
        log.info("Comment created: commentId={}, postId={}, author={}", comment.id(), postId, user.username());

        return Result.success(Mutation.applied(comment, Location.postDetail(postId)));
    }

    @Override
    @Transactional
    public Result<Mutation<Comment>, BlogError> updateComment(Actor actor, UUID postId, UUID commentId, String text) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous comment update rejected: commentId={}", commentId);
            return acting.castFailure();
        }
        User user = acting.getOrThrow();

        var lookup = findOnPost(postId, commentId);
        if (lookup.isFailure()) {
            return lookup.castFailure();
        }

        Comment comment = lookup.getOrThrow();
        if (!OwnershipGuard.canMutate(user, comment.authorId())) {
            log.warn("User {} may not edit comment {}, redirecting to post {}", user.id(), commentId, comment.postId());
            metrics.incrementOwnershipRedirects(MetricsPort.Resource.COMMENT);
            return Result.success(Mutation.redirected(Location.postDetail(comment.postId())));
        }

        var edited = comment.withText(text);
        if (edited.isFailure()) {
            return edited.mapError(BlogError::invalid).castFailure();
        }

        commentRepository.update(edited.getOrThrow());

        metrics.incrementMutations(MetricsPort.Resource.COMMENT, MetricsPort.Action.UPDATED);
        log.info("Comment updated: commentId={}", commentId);

        return Result.success(Mutation.applied(edited.getOrThrow(), Location.postDetail(comment.postId())));
    }

    @Override
    @Transactional
    public Result<Mutation<Void>, BlogError> deleteComment(Actor actor, UUID postId, UUID commentId) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous comment deletion rejected: commentId={}", commentId);
            return acting.castFailure();
        }
        User user = acting.getOrThrow();

        var lookup = findOnPost(postId, commentId);
        if (lookup.isFailure()) {
            return lookup.castFailure();
        }

        Comment comment = lookup.getOrThrow();
        if (!OwnershipGuard.canMutate(user, comment.authorId())) {
            log.warn("User {} may not delete comment {}, redirecting to post {}", user.id(), commentId, comment.postId());
            metrics.incrementOwnershipRedirects(MetricsPort.Resource.COMMENT);
            return Result.success(Mutation.redirected(Location.postDetail(comment.postId())));
        }

        commentRepository.delete(commentId);

        metrics.incrementMutations(MetricsPort.Resource.COMMENT, MetricsPort.Action.DELETED);
        log.info("Comment deleted: commentId={}", commentId);

        return Result.success(Mutation.applied(null, Location.postDetail(comment.postId())));
    }

    /**
     * A comment addressed through another post's URL does not exist there.
     */
    private Result<Comment, BlogError> findOnPost(UUID postId, UUID commentId) {
        return Result.fromOptional(
            commentRepository.findById(commentId).filter(c -> c.postId().equals(postId)),
            () -> new BlogError.CommentNotFound(commentId));
    }
}
