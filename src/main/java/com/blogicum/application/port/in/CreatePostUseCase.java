package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostDraft;
import com.blogicum.domain.model.Result;

public interface CreatePostUseCase {
    Result<Mutation<Post>, BlogError> createPost(Actor actor, PostDraft draft);
}
