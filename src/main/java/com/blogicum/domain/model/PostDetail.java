package com.blogicum.domain.model;

import java.util.List;

public record PostDetail(
    PostSummary post,
    List<CommentView> comments,
    FormDescriptor commentForm
) {}
