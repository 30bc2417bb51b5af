package com.keepnotes.backend.service;

import com.keepnotes.backend.entity.User;

import java.util.Optional;

/**
 * Persistence of user credentials.
 */
public interface CredentialStore {

    Optional<User> findUserByEmail(String email);

    /**
     * Persists a new user. Uniqueness of the email is enforced by the store itself, so two concurrent
     * inserts of the same address cannot both succeed.
     *
     * @throws EmailAlreadyRegisteredException if the email is taken
     */
    User insertUser(String name, String email, String passwordHash);
}
