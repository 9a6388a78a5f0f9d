package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Page;
import com.blogicum.domain.model.PageRequest;
import com.blogicum.domain.model.PostSummary;
import com.blogicum.domain.model.Result;

import java.time.Instant;

public interface GetHomeFeedUseCase {
    Result<Page<PostSummary>, BlogError> listHomeFeed(Instant now, PageRequest page);
}
