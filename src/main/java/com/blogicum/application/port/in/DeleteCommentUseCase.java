package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.Result;

import java.util.UUID;

public interface DeleteCommentUseCase {
    Result<Mutation<Void>, BlogError> deleteComment(Actor actor, UUID postId, UUID commentId);
}
