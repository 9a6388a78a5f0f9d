package com.blogicum.adapter.out.persistence;

import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.CommentView;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;
import com.blogicum.infrastructure.id.TimeOrderedIdGenerator;
import com.blogicum.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcCommentRepositoryTest extends FullStackTestBase {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired
    private JdbcCommentRepository commentRepository;

    @Autowired
    private JdbcPostRepository postRepository;

    @Autowired
    private JdbcUserRepository userRepository;

    private final TimeOrderedIdGenerator ids = new TimeOrderedIdGenerator();

    private User alice;
    private User bob;
    private Post post;

    @BeforeEach
    void setUpFixtures() {
        alice = new User(UserId.random(), "alice", "Alice", "L", "", false, NOW);
        bob = new User(UserId.random(), "bob", "Bob", "B", "", false, NOW);
        userRepository.save(alice);
        userRepository.save(bob);
        post = new Post(UUID.randomUUID(), "Hello", "text", alice.id(), null, NOW, true, NOW);
        postRepository.save(post);
    }

    @Test
    void shouldListCommentsOldestFirstWithAuthors() {
        Comment second = new Comment(ids.generate(), "second", bob.id(), post.id(), NOW.plusSeconds(10));
        Comment first = new Comment(ids.generate(), "first", alice.id(), post.id(), NOW);
        commentRepository.save(second);
        commentRepository.save(first);

        List<CommentView> comments = commentRepository.findByPostId(post.id());

        assertThat(comments).extracting(v -> v.comment().text()).containsExactly("first", "second");
        assertThat(comments.get(1).author().username()).isEqualTo("bob");
    }

    @Test
    void equalCreationTimesShouldFallBackToIdOrder() {
        Comment earlierId = new Comment(ids.generate(), "a", alice.id(), post.id(), NOW);
        Comment laterId = new Comment(ids.generate(), "b", alice.id(), post.id(), NOW);
        commentRepository.save(laterId);
        commentRepository.save(earlierId);

        assertThat(commentRepository.findByPostId(post.id()))
            .extracting(v -> v.comment().id())
            .containsExactly(earlierId.id(), laterId.id());
    }

    @Test
    void shouldUpdateAndDelete() {
        Comment comment = new Comment(ids.generate(), "draft", alice.id(), post.id(), NOW);
        commentRepository.save(comment);

        Comment edited = comment.withText("final").getOrThrow();
        commentRepository.update(edited);
        assertThat(commentRepository.findById(comment.id())).contains(edited);

        commentRepository.delete(comment.id());
        assertThat(commentRepository.findById(comment.id())).isEmpty();
    }
}
