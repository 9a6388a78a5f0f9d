package com.blogicum.adapter.in.web;

import com.blogicum.adapter.in.web.PostController.AuthorResponse;
import com.blogicum.application.port.in.CreateCommentUseCase;
import com.blogicum.application.port.in.DeleteCommentUseCase;
import com.blogicum.application.port.in.UpdateCommentUseCase;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Author;
import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.CommentView;
import com.blogicum.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/posts/{postId}/comments")
@Tag(name = "Comments", description = "Commenting on posts")
public class CommentController {

    private final CreateCommentUseCase createCommentUseCase;
    private final UpdateCommentUseCase updateCommentUseCase;
    private final DeleteCommentUseCase deleteCommentUseCase;
    private final BlogResponses responses;

    public CommentController(
            CreateCommentUseCase createCommentUseCase,
            UpdateCommentUseCase updateCommentUseCase,
            DeleteCommentUseCase deleteCommentUseCase,
            BlogResponses responses) {
        this.createCommentUseCase = createCommentUseCase;
        this.updateCommentUseCase = updateCommentUseCase;
        this.deleteCommentUseCase = deleteCommentUseCase;
        this.responses = responses;
    }

    @PostMapping
    @LoginRequired
    @Operation(summary = "Comment on a post", description = "Adds a comment by the acting user; continues at the post's detail page")
    public ResponseEntity<?> createComment(
            @Parameter(description = "Post ID") @PathVariable UUID postId,
            @RequestBody CommentRequest body,
            HttpServletRequest request) {
        Actor actor = RequestContext.getActor();
        var result = createCommentUseCase.createComment(actor, postId, body.text());
        return responses.mutation(result, HttpStatus.CREATED, comment -> CommentResponse.from(comment, actor), request);
    }

    @PutMapping("/{commentId}")
    @LoginRequired
    @Operation(summary = "Edit a comment", description = "A foreign comment redirects to the post's detail page unchanged")
    public ResponseEntity<?> updateComment(
            @Parameter(description = "Post ID") @PathVariable UUID postId,
            @Parameter(description = "Comment ID") @PathVariable UUID commentId,
            @RequestBody CommentRequest body,
            HttpServletRequest request) {
        Actor actor = RequestContext.getActor();
        var result = updateCommentUseCase.updateComment(actor, postId, commentId, body.text());
        return responses.mutation(result, HttpStatus.OK, comment -> CommentResponse.from(comment, actor), request);
    }

    @DeleteMapping("/{commentId}")
    @LoginRequired
    @Operation(summary = "Delete a comment", description = "A foreign comment redirects to the post's detail page unchanged")
    public ResponseEntity<?> deleteComment(
            @Parameter(description = "Post ID") @PathVariable UUID postId,
            @Parameter(description = "Comment ID") @PathVariable UUID commentId,
            HttpServletRequest request) {
        var result = deleteCommentUseCase.deleteComment(RequestContext.getActor(), postId, commentId);
        return responses.mutation(result, HttpStatus.OK, ignored -> null, request);
    }

    public record CommentRequest(String text) {}

    public record CommentResponse(
        UUID id,
        UUID postId,
        String text,
        AuthorResponse author,
        Instant createdAt
    ) {
        public static CommentResponse from(CommentView view) {
            Comment comment = view.comment();
            return new CommentResponse(
                comment.id(), comment.postId(), comment.text(), AuthorResponse.from(view.author()), comment.createdAt());
        }

        // an applied comment mutation is always made by its author
        static CommentResponse from(Comment comment, Actor actor) {
            AuthorResponse author = actor.user().map(Author::of).map(AuthorResponse::from).orElse(null);
            return new CommentResponse(comment.id(), comment.postId(), comment.text(), author, comment.createdAt());
        }
    }
}
