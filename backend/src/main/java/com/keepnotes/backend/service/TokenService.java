package com.keepnotes.backend.service;

import io.jsonwebtoken.Claims;

import java.time.Duration;
import java.util.Map;

/**
 * Signed, time-limited bearer tokens whose subject is the user's email.
 */
public interface TokenService {

    /** Token for {@code subject} with the configured lifetime. */
    String createToken(String subject);

    String createToken(String subject, Map<String, Object> claims, Duration ttl);

    /**
     * @throws ExpiredTokenException if the token is authentic but not strictly before its expiry
     * @throws InvalidTokenException for anything else that fails to verify
     */
    Claims validateToken(String token);
}
