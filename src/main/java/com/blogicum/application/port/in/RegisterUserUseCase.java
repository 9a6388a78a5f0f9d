package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;

public interface RegisterUserUseCase {
    Result<User, BlogError> register(String username, String firstName, String lastName, String email);
}
