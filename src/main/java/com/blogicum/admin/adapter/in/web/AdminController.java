package com.blogicum.admin.adapter.in.web;

import com.blogicum.adapter.in.web.BlogResponses;
import com.blogicum.adapter.in.web.LoginRequired;
import com.blogicum.admin.application.port.in.CreateCategoryUseCase;
import com.blogicum.admin.application.port.in.GetStatsUseCase;
import com.blogicum.admin.application.port.in.SetCategoryPublishedUseCase;
import com.blogicum.admin.application.port.out.AdminDataPort.DataCounts;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Location;
import com.blogicum.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "Category management and content statistics")
public class AdminController {

    private final CreateCategoryUseCase createCategoryUseCase;
    private final SetCategoryPublishedUseCase setCategoryPublishedUseCase;
    private final GetStatsUseCase getStatsUseCase;
    private final BlogResponses responses;

    public AdminController(
            CreateCategoryUseCase createCategoryUseCase,
            SetCategoryPublishedUseCase setCategoryPublishedUseCase,
            GetStatsUseCase getStatsUseCase,
            BlogResponses responses) {
        this.createCategoryUseCase = createCategoryUseCase;
        this.setCategoryPublishedUseCase = setCategoryPublishedUseCase;
        this.getStatsUseCase = getStatsUseCase;
        this.responses = responses;
    }

    @PostMapping("/categories")
    @LoginRequired
    @Operation(summary = "Create a category", description = "Staff only")
    public ResponseEntity<?> createCategory(@Valid @RequestBody CategoryRequest body, HttpServletRequest request) {
        boolean published = body.published() == null || body.published();
        var result = createCategoryUseCase.createCategory(
            RequestContext.getActor(), body.title(), body.description(), body.slug(), published);
        if (result.isFailure()) {
            return responses.error(result.errorOrNull(), request);
        }
        Category category = result.getOrThrow();
        return ResponseEntity.created(URI.create(Location.category(category.slug()).path()))
            .body(AdminCategoryResponse.from(category));
    }

    @PutMapping("/categories/{slug}/published")
    @LoginRequired
    @Operation(summary = "Publish or hide a category", description = "Staff only; posts of a hidden category leave the public feeds")
    public ResponseEntity<?> setPublished(
            @Parameter(description = "Category slug", example = "travel") @PathVariable String slug,
            @Valid @RequestBody PublishRequest body,
            HttpServletRequest request) {
        var result = setCategoryPublishedUseCase.setCategoryPublished(RequestContext.getActor(), slug, body.published());
        return responses.read(result, AdminCategoryResponse::from, request);
    }

    @GetMapping("/stats")
    @Operation(summary = "Get content statistics", description = "Returns current counts of users, categories, posts and comments")
    public ResponseEntity<DataCounts> stats() {
        return ResponseEntity.ok(getStatsUseCase.getStats());
    }

    public record CategoryRequest(
        @NotBlank String title,
        String description,
        @NotBlank String slug,
        Boolean published
    ) {}

    public record PublishRequest(@NotNull Boolean published) {}

    public record AdminCategoryResponse(
        UUID id,
        String title,
        String description,
        String slug,
        boolean published,
        Instant createdAt
    ) {
        public static AdminCategoryResponse from(Category category) {
            return new AdminCategoryResponse(
                category.id(), category.title(), category.description(), category.slug(),
                category.published(), category.createdAt());
        }
    }
}
