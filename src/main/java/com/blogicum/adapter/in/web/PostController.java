package com.blogicum.adapter.in.web;

import com.blogicum.adapter.in.web.CommentController.CommentResponse;
import com.blogicum.application.port.in.CreatePostUseCase;
import com.blogicum.application.port.in.DeletePostUseCase;
import com.blogicum.application.port.in.GetPostDetailUseCase;
import com.blogicum.application.port.in.UpdatePostUseCase;
import com.blogicum.domain.model.Author;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.FormDescriptor;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostDetail;
import com.blogicum.domain.model.PostDraft;
import com.blogicum.domain.model.PostSummary;
import com.blogicum.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Posts", description = "Post detail and post authoring")
public class PostController {

    private final GetPostDetailUseCase getPostDetailUseCase;
    private final CreatePostUseCase createPostUseCase;
    private final UpdatePostUseCase updatePostUseCase;
    private final DeletePostUseCase deletePostUseCase;
    private final BlogResponses responses;

    public PostController(
            GetPostDetailUseCase getPostDetailUseCase,
            CreatePostUseCase createPostUseCase,
            UpdatePostUseCase updatePostUseCase,
            DeletePostUseCase deletePostUseCase,
            BlogResponses responses) {
        this.getPostDetailUseCase = getPostDetailUseCase;
        this.createPostUseCase = createPostUseCase;
        this.updatePostUseCase = updatePostUseCase;
        this.deletePostUseCase = deletePostUseCase;
        this.responses = responses;
    }

    @GetMapping("/posts/{postId}")
    @Operation(summary = "Get a post", description = "Returns the post with its comments in creation order and an empty comment form")
    public ResponseEntity<?> getPost(
            @Parameter(description = "Post ID") @PathVariable UUID postId,
            HttpServletRequest request) {
        return responses.read(getPostDetailUseCase.getPostDetail(postId), PostDetailResponse::from, request);
    }

    @PostMapping("/posts")
    @LoginRequired
    @Operation(summary = "Create a post", description = "Creates a post authored by the acting user; continues at the author's profile")
    public ResponseEntity<?> createPost(@RequestBody PostRequest body, HttpServletRequest request) {
        var result = createPostUseCase.createPost(RequestContext.getActor(), body.toDraft());
        return responses.mutation(result, HttpStatus.CREATED, PostResponse::from, request);
    }

    @PutMapping("/posts/{postId}")
    @LoginRequired
    @Operation(summary = "Edit a post", description = "Replaces the post's fields; a foreign post redirects to its detail page unchanged")
    public ResponseEntity<?> updatePost(
            @Parameter(description = "Post ID") @PathVariable UUID postId,
            @RequestBody PostRequest body,
            HttpServletRequest request) {
        var result = updatePostUseCase.updatePost(RequestContext.getActor(), postId, body.toDraft());
        return responses.mutation(result, HttpStatus.OK, PostResponse::from, request);
    }

    @DeleteMapping("/posts/{postId}")
    @LoginRequired
    @Operation(summary = "Delete a post", description = "Deletes the post and its comments; continues at the author's profile")
    public ResponseEntity<?> deletePost(
            @Parameter(description = "Post ID") @PathVariable UUID postId,
            HttpServletRequest request) {
        var result = deletePostUseCase.deletePost(RequestContext.getActor(), postId);
        return responses.mutation(result, HttpStatus.OK, ignored -> null, request);
    }

    public record PostRequest(
        String title,
        String text,
        Instant pubDate,
        UUID categoryId,
        Boolean published
    ) {
        PostDraft toDraft() {
            return new PostDraft(title, text, pubDate, categoryId, published);
        }
    }

    public record PostResponse(
        UUID id,
        String title,
        String text,
        Instant pubDate,
        boolean published,
        String authorId,
        UUID categoryId,
        Instant createdAt
    ) {
        public static PostResponse from(Post post) {
            return new PostResponse(
                post.id(),
                post.title(),
                post.text(),
                post.pubDate(),
                post.published(),
                post.authorId().toString(),
                post.categoryId(),
                post.createdAt()
            );
        }
    }

    public record AuthorResponse(String id, String username, String firstName, String lastName) {
        public static AuthorResponse from(Author author) {
            return new AuthorResponse(author.id().toString(), author.username(), author.firstName(), author.lastName());
        }
    }

    public record CategoryResponse(UUID id, String title, String description, String slug) {
        public static CategoryResponse from(Category category) {
            return category == null
                ? null
                : new CategoryResponse(category.id(), category.title(), category.description(), category.slug());
        }
    }

    public record PostSummaryResponse(
        UUID id,
        String title,
        String text,
        Instant pubDate,
        boolean published,
        AuthorResponse author,
        CategoryResponse category,
        long commentCount,
        Instant createdAt
    ) {
        public static PostSummaryResponse from(PostSummary summary) {
            Post post = summary.post();
            return new PostSummaryResponse(
                post.id(),
                post.title(),
                post.text(),
                post.pubDate(),
                post.published(),
                AuthorResponse.from(summary.author()),
                CategoryResponse.from(summary.category()),
                summary.commentCount(),
                post.createdAt()
            );
        }
    }

    public record FormResponse(String action, List<String> fields) {
        public static FormResponse from(FormDescriptor form) {
            return new FormResponse(form.action().path(), form.fields());
        }
    }

    public record PostDetailResponse(
        PostSummaryResponse post,
        List<CommentResponse> comments,
        FormResponse commentForm
    ) {
        public static PostDetailResponse from(PostDetail detail) {
            return new PostDetailResponse(
                PostSummaryResponse.from(detail.post()),
                detail.comments().stream().map(CommentResponse::from).toList(),
                FormResponse.from(detail.commentForm())
            );
        }
    }
}
