package com.keepnotes.backend.service;

import com.keepnotes.backend.dto.ResolvedIdentity;
import com.keepnotes.backend.entity.User;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a bearer token into the user it was issued for.
 * <p>
 * Nothing is cached: every call validates the token again and reads the user from the store, so a
 * renamed or removed user is seen on the next request. Every failure has the same
 * {@link AuthError#UNAUTHENTICATED} kind; only the internal reason differs.
 */
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    private final TokenService tokenService;
    private final CredentialStore credentialStore;

    public AuthResult<ResolvedIdentity> resolve(String token) {
        Claims claims;
        try {
            claims = tokenService.validateToken(token);
        } catch (ExpiredTokenException e) {
            return AuthResult.failure(AuthError.UNAUTHENTICATED, "token expired");
        } catch (InvalidTokenException e) {
            return AuthResult.failure(AuthError.UNAUTHENTICATED, "invalid token: " + e.getMessage());
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return AuthResult.failure(AuthError.UNAUTHENTICATED, "token has no subject");
        }

        Optional<User> user = credentialStore.findUserByEmail(subject);
        if (user.isEmpty()) {
            return AuthResult.failure(AuthError.UNAUTHENTICATED, "no user for token subject");
        }
        User u = user.get();
        return AuthResult.success(new ResolvedIdentity(u.getId(), u.getName(), u.getEmail()));
    }
}
