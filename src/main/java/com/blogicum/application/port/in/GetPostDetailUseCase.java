package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.PostDetail;
import com.blogicum.domain.model.Result;

import java.util.UUID;

public interface GetPostDetailUseCase {
    Result<PostDetail, BlogError> getPostDetail(UUID postId);
}
