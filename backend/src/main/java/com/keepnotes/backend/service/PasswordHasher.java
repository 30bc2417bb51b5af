package com.keepnotes.backend.service;

public interface PasswordHasher {

    /**
     * Salted one-way hash of {@code plaintext}.
     *
     * @throws PasswordHashingException if the underlying hashing fails
     */
    String hash(String plaintext);

    /**
     * Checks {@code plaintext} against a hash produced by {@link #hash(String)}.
     *
     * @throws PasswordVerificationException if {@code hash} is not a well-formed hash
     */
    boolean verify(String plaintext, String hash);
}
