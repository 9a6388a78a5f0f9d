package com.blogicum.admin.adapter.out;

import com.blogicum.admin.application.port.out.AdminDataPort;
import com.blogicum.application.port.out.CategoryRepository;
import com.blogicum.application.port.out.CommentRepository;
import com.blogicum.application.port.out.PostRepository;
import com.blogicum.application.port.out.UserRepository;
import org.springframework.stereotype.Component;

@Component
public class AdminDataAdapter implements AdminDataPort {

    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;

    public AdminDataAdapter(
            UserRepository userRepository,
            CategoryRepository categoryRepository,
            PostRepository postRepository,
            CommentRepository commentRepository) {
        this.userRepository = userRepository;
        this.categoryRepository = categoryRepository;
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
    }

    @Override
    public DataCounts getCounts() {
        return new DataCounts(
            userRepository.count(),
            categoryRepository.count(),
            postRepository.count(),
            commentRepository.count()
        );
    }
}
