package com.blogicum.application.service;

import com.blogicum.application.port.out.CategoryRepository;
import com.blogicum.application.port.out.MetricsPort;
import com.blogicum.application.port.out.PostRepository;
import com.blogicum.application.port.out.UserRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Author;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.PageRequest;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostSummary;
import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;
import com.blogicum.domain.policy.PostFilter;
import com.blogicum.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FeedService")
class FeedServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private PostRepository postRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private MetricsPort metrics;

    private FeedService feedService;

    private final User alice = new User(UserId.random(), "alice", "Alice", "L", "a@example.com", false, NOW);

    @BeforeEach
    void setUp() {
        feedService = new FeedService(postRepository, categoryRepository, userRepository, new AppProperties(), metrics);
    }

    private PostSummary summary(String title) {
        Post post = new Post(UUID.randomUUID(), title, "x", alice.id(), null, NOW.minusSeconds(60), true, NOW);
        return new PostSummary(post, Author.of(alice), null, 0);
    }

    @Nested
    @DisplayName("listHomeFeed")
    class HomeFeedTests {

        @Test
        @DisplayName("Should query with public visibility at the given instant")
        void shouldFilterByVisibilityAtNow() {
            // Given
            when(postRepository.countMatching(any())).thenReturn(1L);
            when(postRepository.findMatching(any(), anyLong(), anyInt())).thenReturn(List.of(summary("a")));

            // When
            var result = feedService.listHomeFeed(NOW, PageRequest.first());

            // Then
            assertTrue(result.isSuccess());
            ArgumentCaptor<PostFilter> filter = ArgumentCaptor.forClass(PostFilter.class);
            verify(postRepository).countMatching(filter.capture());
            assertEquals(PostFilter.publicFeed(NOW), filter.getValue());
            verify(metrics).incrementFeedRequests(MetricsPort.Feed.HOME);
        }

        @Test
        @DisplayName("Should return an empty first page without fetching rows")
        void shouldReturnEmptyFirstPage() {
            // Given
            when(postRepository.countMatching(any())).thenReturn(0L);

            // When
            var result = feedService.listHomeFeed(NOW, PageRequest.first());

            // Then
            assertTrue(result.isSuccess());
            assertTrue(result.getOrThrow().data().isEmpty());
            assertEquals(1, result.getOrThrow().totalPages());
            verify(postRepository, never()).findMatching(any(), anyLong(), anyInt());
        }

        @Test
        @DisplayName("Should use offset of the requested page with page size 10")
        void shouldPageByTen() {
            // Given
            when(postRepository.countMatching(any())).thenReturn(15L);
            List<PostSummary> rest = Collections.nCopies(5, summary("x"));
            when(postRepository.findMatching(any(), eq(10L), eq(10))).thenReturn(rest);

            // When
            var page = feedService.listHomeFeed(NOW, PageRequest.of(2)).getOrThrow();

            // Then
            assertEquals(5, page.data().size());
            assertEquals(2, page.number());
            assertFalse(page.hasNext());
            assertTrue(page.hasPrevious());
        }

        @Test
        @DisplayName("Should return PageNotFound beyond the last page")
        void shouldRejectPageBeyondLast() {
            when(postRepository.countMatching(any())).thenReturn(10L);

            var result = feedService.listHomeFeed(NOW, PageRequest.of(2));

            assertInstanceOf(BlogError.PageNotFound.class, result.errorOrNull());
            verify(postRepository, never()).findMatching(any(), anyLong(), anyInt());
        }

        @Test
        @DisplayName("Should resolve 'last' to the final page")
        void shouldResolveLast() {
            when(postRepository.countMatching(any())).thenReturn(21L);
            when(postRepository.findMatching(any(), eq(20L), eq(10))).thenReturn(List.of(summary("z")));

            var page = feedService.listHomeFeed(NOW, PageRequest.lastPage()).getOrThrow();

            assertEquals(3, page.number());
            assertEquals(1, page.data().size());
        }
    }

    @Nested
    @DisplayName("listCategoryFeed")
    class CategoryFeedTests {

        @Test
        @DisplayName("Should list the category's visible posts")
        void shouldListCategory() {
            // Given
            Category news = new Category(UUID.randomUUID(), "News", "", "news", true, NOW);
            when(categoryRepository.findBySlug("news")).thenReturn(Optional.of(news));
            when(postRepository.countMatching(PostFilter.publicCategoryFeed(news.id(), NOW))).thenReturn(2L);
            when(postRepository.findMatching(eq(PostFilter.publicCategoryFeed(news.id(), NOW)), eq(0L), eq(10)))
                .thenReturn(List.of(summary("a"), summary("b")));

            // When
            var result = feedService.listCategoryFeed("news", NOW, PageRequest.first());

            // Then
            assertTrue(result.isSuccess());
            assertEquals(news, result.getOrThrow().category());
            assertEquals(2, result.getOrThrow().posts().data().size());
        }

        @Test
        @DisplayName("Should return NotFound for an unpublished category")
        void shouldHideUnpublishedCategory() {
            Category hidden = new Category(UUID.randomUUID(), "Hidden", "", "hidden", false, NOW);
            when(categoryRepository.findBySlug("hidden")).thenReturn(Optional.of(hidden));

            var result = feedService.listCategoryFeed("hidden", NOW, PageRequest.first());

            assertInstanceOf(BlogError.CategoryNotFound.class, result.errorOrNull());
            verifyNoInteractions(postRepository);
        }

        @Test
        @DisplayName("Should return NotFound for an unknown slug")
        void shouldRejectUnknownSlug() {
            when(categoryRepository.findBySlug("nope")).thenReturn(Optional.empty());

            var result = feedService.listCategoryFeed("nope", NOW, PageRequest.first());

            assertInstanceOf(BlogError.CategoryNotFound.class, result.errorOrNull());
        }
    }

    @Nested
    @DisplayName("listAuthorFeed")
    class AuthorFeedTests {

        @Test
        @DisplayName("Should list all of the author's posts without visibility filter")
        void shouldListAuthorPosts() {
            // Given
            when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
            when(postRepository.countMatching(PostFilter.authorFeed(alice.id()))).thenReturn(1L);
            when(postRepository.findMatching(eq(PostFilter.authorFeed(alice.id())), eq(0L), eq(10)))
                .thenReturn(List.of(summary("draft")));

            // When
            var result = feedService.listAuthorFeed("alice", PageRequest.first());

            // Then
            assertTrue(result.isSuccess());
            assertEquals(alice, result.getOrThrow().profile());
            verify(metrics).incrementFeedRequests(MetricsPort.Feed.PROFILE);
        }

        @Test
        @DisplayName("Should return UserNotFound for an unknown username")
        void shouldRejectUnknownUser() {
            when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

            var result = feedService.listAuthorFeed("ghost", PageRequest.first());

            assertInstanceOf(BlogError.UserNotFound.class, result.errorOrNull());
        }
    }
}
