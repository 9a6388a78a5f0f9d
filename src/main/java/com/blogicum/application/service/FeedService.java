package com.blogicum.application.service;

import com.blogicum.application.port.in.GetAuthorFeedUseCase;
import com.blogicum.application.port.in.GetCategoryFeedUseCase;
import com.blogicum.application.port.in.GetHomeFeedUseCase;
import com.blogicum.application.port.out.CategoryRepository;
import com.blogicum.application.port.out.MetricsPort;
import com.blogicum.application.port.out.PostRepository;
import com.blogicum.application.port.out.UserRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.CategoryFeed;
import com.blogicum.domain.model.Page;
import com.blogicum.domain.model.PageRequest;
import com.blogicum.domain.model.PostSummary;
import com.blogicum.domain.model.ProfileFeed;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;
import com.blogicum.domain.policy.PostFilter;
import com.blogicum.domain.policy.PostVisibility;
import com.blogicum.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Home, category and profile listings. Home and category feeds only show publicly visible posts;
 * a profile lists every post of its author.
 */
@Service
public class FeedService implements GetHomeFeedUseCase, GetCategoryFeedUseCase, GetAuthorFeedUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final PostRepository postRepository;
    private final CategoryRepository categoryRepository;
    private final UserRepository userRepository;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public FeedService(
            PostRepository postRepository,
            CategoryRepository categoryRepository,
            UserRepository userRepository,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.postRepository = postRepository;
        this.categoryRepository = categoryRepository;
        this.userRepository = userRepository;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    @Transactional(readOnly = true)
    public Result<Page<PostSummary>, BlogError> listHomeFeed(Instant now, PageRequest page) {
        log.debug("Listing home feed: page={}, now={}", page, now);
        metrics.incrementFeedRequests(MetricsPort.Feed.HOME);

        return listPage(PostFilter.publicFeed(now), page);
    }

    @Override
    @Transactional(readOnly = true)
    public Result<CategoryFeed, BlogError> listCategoryFeed(String categorySlug, Instant now, PageRequest page) {
        log.debug("Listing category feed: slug={}, page={}, now={}", categorySlug, page, now);
        metrics.incrementFeedRequests(MetricsPort.Feed.CATEGORY);

        var category = categoryRepository.findBySlug(categorySlug)
            .filter(PostVisibility::isCategoryVisible);
        if (category.isEmpty()) {
            log.debug("Category missing or unpublished: slug={}", categorySlug);
            return Result.failure(new BlogError.CategoryNotFound(categorySlug));
        }

        Category resolved = category.get();
        return listPage(PostFilter.publicCategoryFeed(resolved.id(), now), page)
            .map(posts -> new CategoryFeed(resolved, posts));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<ProfileFeed, BlogError> listAuthorFeed(String username, PageRequest page) {
        log.debug("Listing profile feed: username={}, page={}", username, page);
        metrics.incrementFeedRequests(MetricsPort.Feed.PROFILE);

        var author = userRepository.findByUsername(username);
        if (author.isEmpty()) {
            return Result.failure(new BlogError.UserNotFound(username));
        }

        User profile = author.get();
        return listPage(PostFilter.authorFeed(profile.id()), page)
            .map(posts -> new ProfileFeed(profile, posts));
    }

    private Result<Page<PostSummary>, BlogError> listPage(PostFilter filter, PageRequest page) {
        long total = postRepository.countMatching(filter);

        var window = page.resolve(total, appProperties.getFeed().getPageSize());
        if (window.isFailure()) {
            log.debug("Page out of range: page={}, total={}", page, total);
            return window.castFailure();
        }

        var resolved = window.getOrThrow();
        List<PostSummary> posts = total == 0
            ? List.of()
            : postRepository.findMatching(filter, resolved.offset(), resolved.size());

        log.debug("Returning {} of {} posts, page {}/{}", posts.size(), total, resolved.number(), resolved.totalPages());
        return Result.success(Page.of(posts, resolved));
    }
}
