package com.blogicum.application.port.out;

import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;

import java.util.Optional;

public interface UserRepository {
    /**
     * Inserts a new account.
     *
     * @return false if the username is already taken; nothing is written then
     */
    boolean save(User user);

    /**
     * Writes the editable profile fields.
     *
     * @return false if the new username is already taken by another account
     */
    boolean update(User user);
    Optional<User> findById(UserId id);
    Optional<User> findByUsername(String username);
    boolean existsByUsername(String username);
    long count();
    void deleteAll();
}
