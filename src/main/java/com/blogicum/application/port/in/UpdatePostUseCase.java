package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.Post;
import com.blogicum.domain.model.PostDraft;
import com.blogicum.domain.model.Result;

import java.util.UUID;

public interface UpdatePostUseCase {
    Result<Mutation<Post>, BlogError> updatePost(Actor actor, UUID postId, PostDraft draft);
}
