package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.CategoryFeed;
import com.blogicum.domain.model.PageRequest;
import com.blogicum.domain.model.Result;

import java.time.Instant;

public interface GetCategoryFeedUseCase {
    Result<CategoryFeed, BlogError> listCategoryFeed(String categorySlug, Instant now, PageRequest page);
}
