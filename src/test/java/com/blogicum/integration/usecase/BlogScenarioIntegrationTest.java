package com.blogicum.integration.usecase;

import com.blogicum.adapter.out.persistence.JdbcCategoryRepository;
import com.blogicum.adapter.out.persistence.JdbcCommentRepository;
import com.blogicum.adapter.out.persistence.JdbcPostRepository;
import com.blogicum.adapter.out.persistence.JdbcUserRepository;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;
import com.blogicum.domain.policy.PostFilter;
import com.blogicum.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end behaviour of feeds and author-only writes:
 * HTTP -> AuthFilter -> controllers -> services -> PostgreSQL.
 */
@SpringBootTest
@AutoConfigureMockMvc
@EnabledIf("isDockerAvailable")
@DisplayName("Blog scenarios")
class BlogScenarioIntegrationTest extends FullStackTestBase {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcUserRepository userRepository;

    @Autowired
    private JdbcCategoryRepository categoryRepository;

    @Autowired
    private JdbcPostRepository postRepository;

    @Autowired
    private JdbcCommentRepository commentRepository;

    private final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    private User alice;
    private User bob;
    private Category news;

    @BeforeEach
    void setUp() {
        alice = new User(UserId.random(), "alice", "Alice", "L", "alice@example.com", false, now);
        bob = new User(UserId.random(), "bob", "Bob", "B", "bob@example.com", false, now);
        userRepository.save(alice);
        userRepository.save(bob);
        news = new Category(UUID.randomUUID(), "News", "", "news", true, now);
        categoryRepository.save(news);
    }

    private Post savePost(String title, Instant pubDate, boolean published) {
        Post post = new Post(UUID.randomUUID(), title, "text", alice.id(), news.id(), pubDate, published, now);
        postRepository.save(post);
        return post;
    }

    @Test
    @DisplayName("Category feed lists only visible posts, newest first")
    void categoryFeedShowsOnlyVisiblePosts() throws Exception {
        // Given
        savePost("Yesterday", now.minus(1, ChronoUnit.DAYS), true);
        savePost("Last week", now.minus(7, ChronoUnit.DAYS), true);
        savePost("Tomorrow", now.plus(1, ChronoUnit.DAYS), true);

        // When / Then
        mockMvc.perform(get("/api/v1/categories/news/posts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.posts.data.length()").value(2))
            .andExpect(jsonPath("$.posts.data[0].title").value("Yesterday"))
            .andExpect(jsonPath("$.posts.data[1].title").value("Last week"))
            .andExpect(jsonPath("$.posts.pagination.totalItems").value(2));
    }

    @Test
    @DisplayName("Unpublishing a category removes it and its posts from public listings")
    void unpublishedCategoryDisappears() throws Exception {
        savePost("Yesterday", now.minus(1, ChronoUnit.DAYS), true);
        categoryRepository.update(news.withPublished(false));

        mockMvc.perform(get("/api/v1/categories/news/posts"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/posts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    @DisplayName("Profile lists scheduled and unpublished posts of the author")
    void profileShowsAllPosts() throws Exception {
        savePost("Tomorrow", now.plus(1, ChronoUnit.DAYS), true);
        savePost("Draft", now.minus(1, ChronoUnit.DAYS), false);

        mockMvc.perform(get("/api/v1/profiles/alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.posts.data.length()").value(2));
    }

    @Test
    @DisplayName("Pagination is strict and accepts 'last'")
    void strictPagination() throws Exception {
        for (int i = 0; i < 11; i++) {
            savePost("Post " + i, now.minus(i + 1, ChronoUnit.HOURS), true);
        }

        mockMvc.perform(get("/api/v1/posts").param("page", "last"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pagination.page").value(2))
            .andExpect(jsonPath("$.data.length()").value(1));
        mockMvc.perform(get("/api/v1/posts").param("page", "3"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/posts").param("page", "0"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("A non-author deleting a post is redirected and the post survives")
    void nonAuthorDeleteIsRedirected() throws Exception {
        Post post = savePost("Alice's", now.minus(1, ChronoUnit.DAYS), true);

        mockMvc.perform(delete("/api/v1/posts/{id}", post.id()).header("X-User-Id", bob.id().toString()))
            .andExpect(status().isFound())
            .andExpect(header().string("Location", "/api/v1/posts/" + post.id()));

        assertThat(postRepository.findById(post.id())).isPresent();
    }

    @Test
    @DisplayName("The author deleting a post removes it and its comments")
    void authorDeleteCascades() throws Exception {
        Post post = savePost("Alice's", now.minus(1, ChronoUnit.DAYS), true);
        commentRepository.save(new Comment(UUID.randomUUID(), "hi", bob.id(), post.id(), now));

        mockMvc.perform(delete("/api/v1/posts/{id}", post.id()).header("X-User-Id", alice.id().toString()))
            .andExpect(status().isOk())
            .andExpect(header().string("Location", "/api/v1/profiles/alice"));

        assertThat(postRepository.findById(post.id())).isEmpty();
        assertThat(commentRepository.count()).isZero();
    }

    @Test
    @DisplayName("Anonymous writers are sent to the login page")
    void anonymousWriteRedirectsToLogin() throws Exception {
        mockMvc.perform(post("/api/v1/posts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"x\",\"text\":\"y\",\"pubDate\":\"2024-01-01T00:00:00Z\"}"))
            .andExpect(status().isFound())
            .andExpect(header().string("Location", "/auth/login/?next=%2Fapi%2Fv1%2Fposts"));

        assertThat(postRepository.count()).isZero();
    }

    @Test
    @DisplayName("Creating a post and commenting on it shows up on the detail page")
    void createPostThenComment() throws Exception {
        mockMvc.perform(post("/api/v1/posts")
                .header("X-User-Id", alice.id().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Fresh\",\"text\":\"Body\",\"pubDate\":\"2024-01-01T00:00:00Z\",\"categoryId\":\""
                    + news.id() + "\"}"))
            .andExpect(status().isCreated())
            .andExpect(header().string("Location", "/api/v1/profiles/alice"));

        UUID postId = postRepository.findMatching(
            PostFilter.authorFeed(alice.id()), 0, 1).get(0).post().id();

        mockMvc.perform(post("/api/v1/posts/{id}/comments", postId)
                .header("X-User-Id", bob.id().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Welcome\"}"))
            .andExpect(status().isCreated())
            .andExpect(header().string("Location", "/api/v1/posts/" + postId));

        mockMvc.perform(get("/api/v1/posts/{id}", postId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.post.commentCount").value(1))
            .andExpect(jsonPath("$.comments[0].author.username").value("bob"));
    }

    @Test
    @DisplayName("A comment addressed through another post is not found")
    void commentThroughForeignPostIsNotFound() throws Exception {
        Post first = savePost("First", now.minus(1, ChronoUnit.DAYS), true);
        Post second = savePost("Second", now.minus(1, ChronoUnit.DAYS), true);
        Comment comment = new Comment(UUID.randomUUID(), "hi", bob.id(), first.id(), now);
        commentRepository.save(comment);

        mockMvc.perform(put("/api/v1/posts/{postId}/comments/{commentId}", second.id(), comment.id())
                .header("X-User-Id", bob.id().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"edited\"}"))
            .andExpect(status().isNotFound());

        assertThat(commentRepository.findById(comment.id()).orElseThrow().text()).isEqualTo("hi");
    }

    @Test
    @DisplayName("Registration rejects a taken username")
    void duplicateRegistrationIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/auth/registration")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"alice\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("USERNAME_TAKEN"));
    }

    @Test
    @DisplayName("Only staff may create categories")
    void nonStaffCannotCreateCategory() throws Exception {
        mockMvc.perform(post("/api/v1/admin/categories")
                .header("X-User-Id", alice.id().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Travel\",\"slug\":\"travel\"}"))
            .andExpect(status().isForbidden());

        assertThat(categoryRepository.existsBySlug("travel")).isFalse();
    }
}
