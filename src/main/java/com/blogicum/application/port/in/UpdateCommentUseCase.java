package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Comment;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.Result;

import java.util.UUID;

public interface UpdateCommentUseCase {
    Result<Mutation<Comment>, BlogError> updateComment(Actor actor, UUID postId, UUID commentId, String text);
}
