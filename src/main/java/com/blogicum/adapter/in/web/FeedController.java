package com.blogicum.adapter.in.web;

import com.blogicum.adapter.in.web.PostController.CategoryResponse;
import com.blogicum.adapter.in.web.PostController.PostSummaryResponse;
import com.blogicum.application.port.in.GetAuthorFeedUseCase;
import com.blogicum.application.port.in.GetCategoryFeedUseCase;
import com.blogicum.application.port.in.GetHomeFeedUseCase;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.CategoryFeed;
import com.blogicum.domain.model.PageRequest;
import com.blogicum.domain.model.ProfileFeed;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

/**
 * Paginated post listings. The visibility cutoff is taken from the clock on every request.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Feeds", description = "Home, category and profile listings")
public class FeedController {

    private final GetHomeFeedUseCase getHomeFeedUseCase;
    private final GetCategoryFeedUseCase getCategoryFeedUseCase;
    private final GetAuthorFeedUseCase getAuthorFeedUseCase;
    private final Clock clock;
    private final BlogResponses responses;

    public FeedController(
            GetHomeFeedUseCase getHomeFeedUseCase,
            GetCategoryFeedUseCase getCategoryFeedUseCase,
            GetAuthorFeedUseCase getAuthorFeedUseCase,
            Clock clock,
            BlogResponses responses) {
        this.getHomeFeedUseCase = getHomeFeedUseCase;
        this.getCategoryFeedUseCase = getCategoryFeedUseCase;
        this.getAuthorFeedUseCase = getAuthorFeedUseCase;
        this.clock = clock;
        this.responses = responses;
    }

    @GetMapping("/posts")
    @Operation(summary = "Home feed", description = "Publicly visible posts, newest publication date first")
    public ResponseEntity<?> homeFeed(
            @Parameter(description = "Page number starting at 1, or 'last'")
            @RequestParam(required = false) String page,
            HttpServletRequest request) {
        Instant now = Instant.now(clock);
        var result = PageRequest.parse(page)
            .flatMap(pageRequest -> getHomeFeedUseCase.listHomeFeed(now, pageRequest));
        return responses.read(result, posts -> PageResponse.from(posts, PostSummaryResponse::from), request);
    }

    @GetMapping("/categories/{slug}/posts")
    @Operation(summary = "Category feed", description = "Publicly visible posts of a published category")
    public ResponseEntity<?> categoryFeed(
            @Parameter(description = "Category slug", example = "travel") @PathVariable String slug,
            @Parameter(description = "Page number starting at 1, or 'last'")
            @RequestParam(required = false) String page,
            HttpServletRequest request) {
        Instant now = Instant.now(clock);
        Result<CategoryFeed, BlogError> result = PageRequest.parse(page)
            .flatMap(pageRequest -> getCategoryFeedUseCase.listCategoryFeed(slug, now, pageRequest));
        return responses.read(result, CategoryFeedResponse::from, request);
    }

    @GetMapping("/profiles/{username}")
    @Operation(summary = "Profile feed", description = "A user's profile and all of their posts, including unpublished and scheduled ones")
    public ResponseEntity<?> profileFeed(
            @Parameter(description = "Username", example = "alice") @PathVariable String username,
            @Parameter(description = "Page number starting at 1, or 'last'")
            @RequestParam(required = false) String page,
            HttpServletRequest request) {
        Result<ProfileFeed, BlogError> result = PageRequest.parse(page)
            .flatMap(pageRequest -> getAuthorFeedUseCase.listAuthorFeed(username, pageRequest));
        return responses.read(result, ProfileFeedResponse::from, request);
    }

    public record CategoryFeedResponse(
        CategoryResponse category,
        PageResponse<PostSummaryResponse> posts
    ) {
        public static CategoryFeedResponse from(CategoryFeed feed) {
            return new CategoryFeedResponse(
                CategoryResponse.from(feed.category()),
                PageResponse.from(feed.posts(), PostSummaryResponse::from)
            );
        }
    }

    public record ProfileResponse(
        String id,
        String username,
        String firstName,
        String lastName,
        String email
    ) {
        public static ProfileResponse from(User user) {
            return new ProfileResponse(
                user.id().toString(), user.username(), user.firstName(), user.lastName(), user.email());
        }
    }

    public record ProfileFeedResponse(
        ProfileResponse profile,
        PageResponse<PostSummaryResponse> posts
    ) {
        public static ProfileFeedResponse from(ProfileFeed feed) {
            return new ProfileFeedResponse(
                ProfileResponse.from(feed.profile()),
                PageResponse.from(feed.posts(), PostSummaryResponse::from)
            );
        }
    }
}
