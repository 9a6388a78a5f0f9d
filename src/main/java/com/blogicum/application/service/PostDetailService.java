package com.blogicum.application.service;

import com.blogicum.application.port.in.GetPostDetailUseCase;
import com.blogicum.application.port.out.CommentRepository;
import com.blogicum.application.port.out.PostRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.CommentView;
import com.blogicum.domain.model.FormDescriptor;
import com.blogicum.domain.model.PostDetail;
import com.blogicum.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Single post page. Lookup is by id only: unpublished and scheduled posts are returned too.
 */
@Service
public class PostDetailService implements GetPostDetailUseCase {

    private static final Logger log = LoggerFactory.getLogger(PostDetailService.class);

    private final PostRepository postRepository;
    private final CommentRepository commentRepository;

    public PostDetailService(PostRepository postRepository, CommentRepository commentRepository) {
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Result<PostDetail, BlogError> getPostDetail(UUID postId) {
        log.debug("Fetching post detail: postId={}", postId);

        var post = postRepository.findSummaryById(postId);
        if (post.isEmpty()) {
            return Result.failure(new BlogError.PostNotFound(postId));
        }

        List<CommentView> comments = commentRepository.findByPostId(postId);
        log.debug("Post {} has {} comments", postId, comments.size());

        return Result.success(new PostDetail(post.get(), comments, FormDescriptor.comment(postId)));
    }
}
