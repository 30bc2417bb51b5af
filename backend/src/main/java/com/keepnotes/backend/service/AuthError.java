package com.keepnotes.backend.service;

/**
 * Expected authentication outcomes that callers translate into a response.
 */
public enum AuthError {
    /** Bad credentials, an invalid or expired token, or a token whose user is gone. */
    UNAUTHENTICATED,
    /** The email address is already registered. */
    CONFLICT
}
