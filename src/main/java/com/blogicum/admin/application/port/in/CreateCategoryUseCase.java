package com.blogicum.admin.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Result;

public interface CreateCategoryUseCase {
    Result<Category, BlogError> createCategory(
        Actor actor, String title, String description, String slug, boolean published);
}
