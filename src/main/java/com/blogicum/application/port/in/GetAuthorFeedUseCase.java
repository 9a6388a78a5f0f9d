package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.PageRequest;
import com.blogicum.domain.model.ProfileFeed;
import com.blogicum.domain.model.Result;

public interface GetAuthorFeedUseCase {
    Result<ProfileFeed, BlogError> listAuthorFeed(String username, PageRequest page);
}
