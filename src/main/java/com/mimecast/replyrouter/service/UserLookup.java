package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.User;

import java.util.Optional;

/**
 * User lookup interface.
 */
public interface UserLookup {

    /**
     * Finds a user by primary or secondary email address.
     *
     * @param email Email address.
     * @return Optional of User.
     */
    Optional<User> findByAnyEmail(String email);
}
