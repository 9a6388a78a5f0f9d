package com.blogicum.application.port.in;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.ProfileChanges;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;

public interface UpdateProfileUseCase {
    Result<Mutation<User>, BlogError> updateProfile(Actor actor, String username, ProfileChanges changes);
}
