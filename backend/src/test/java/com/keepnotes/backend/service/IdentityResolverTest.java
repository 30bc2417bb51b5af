package com.keepnotes.backend.service;

import com.keepnotes.backend.dto.ResolvedIdentity;
import com.keepnotes.backend.entity.User;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    @Mock private TokenService tokenService;
    @Mock private CredentialStore credentialStore;

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(tokenService, credentialStore);
    }

    @Test
    void resolveReturnsIdentityOfTokenSubject() {
        when(tokenService.validateToken("t")).thenReturn(Jwts.claims().setSubject("ann@x.com"));
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.of(user("u-1", "Ann", "ann@x.com")));

        AuthResult<ResolvedIdentity> result = resolver.resolve("t");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo(new ResolvedIdentity("u-1", "Ann", "ann@x.com"));
    }

    @Test
    void expiredTokenIsUnauthenticated() {
        when(tokenService.validateToken("t")).thenThrow(new ExpiredTokenException("Token expired", null));

        AuthResult<ResolvedIdentity> result = resolver.resolve("t");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        assertThat(result.getReason()).isEqualTo("token expired");
        verify(credentialStore, never()).findUserByEmail(any());
    }

    @Test
    void invalidTokenIsUnauthenticated() {
        when(tokenService.validateToken("t")).thenThrow(new InvalidTokenException("Invalid token"));

        AuthResult<ResolvedIdentity> result = resolver.resolve("t");

        assertThat(result.getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        verify(credentialStore, never()).findUserByEmail(any());
    }

    @Test
    void missingOrBlankSubjectIsUnauthenticated() {
        when(tokenService.validateToken("no-sub")).thenReturn(Jwts.claims());
        when(tokenService.validateToken("blank-sub")).thenReturn(Jwts.claims().setSubject("  "));

        assertThat(resolver.resolve("no-sub").getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        assertThat(resolver.resolve("blank-sub").getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        verify(credentialStore, never()).findUserByEmail(any());
    }

    @Test
    void unknownUserIsUnauthenticatedLikeAnyOtherFailure() {
        when(tokenService.validateToken("t")).thenReturn(Jwts.claims().setSubject("gone@x.com"));
        when(credentialStore.findUserByEmail("gone@x.com")).thenReturn(Optional.empty());

        AuthResult<ResolvedIdentity> result = resolver.resolve("t");

        assertThat(result.getError()).isEqualTo(AuthError.UNAUTHENTICATED);
    }

    @Test
    void everyCallReadsTheStoreAgain() {
        when(tokenService.validateToken("t")).thenReturn(Jwts.claims().setSubject("ann@x.com"));
        when(credentialStore.findUserByEmail("ann@x.com"))
                .thenReturn(Optional.of(user("u-1", "Ann", "ann@x.com")))
                .thenReturn(Optional.of(user("u-1", "Annie", "ann@x.com")));

        assertThat(resolver.resolve("t").getValue().name()).isEqualTo("Ann");
        assertThat(resolver.resolve("t").getValue().name()).isEqualTo("Annie");
        verify(tokenService, times(2)).validateToken("t");
    }

    private static User user(String id, String name, String email) {
        User user = new User();
        user.setId(id);
        user.setName(name);
        user.setEmail(email);
        user.setPasswordHash("$2a$04$abcdefghijklmnopqrstuuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0");
        return user;
    }
}
