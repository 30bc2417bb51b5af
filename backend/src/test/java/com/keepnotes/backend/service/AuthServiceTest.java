package com.keepnotes.backend.service;

import com.keepnotes.backend.dto.LoginRequest;
import com.keepnotes.backend.dto.LoginResponse;
import com.keepnotes.backend.dto.MessageResponse;
import com.keepnotes.backend.dto.SignupRequest;
import com.keepnotes.backend.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String HASH = "$2a$04$abcdefghijklmnopqrstuuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0";

    @Mock private CredentialStore credentialStore;
    @Mock private PasswordHasher passwordHasher;
    @Mock private TokenService tokenService;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(credentialStore, passwordHasher, tokenService);
    }

    @Test
    void loginIssuesBearerTokenForEmail() {
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.of(ann()));
        when(passwordHasher.verify("secret123", HASH)).thenReturn(true);
        when(tokenService.createToken("ann@x.com")).thenReturn("token-1");

        AuthResult<LoginResponse> result = authService.login(new LoginRequest("ann@x.com", "secret123"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getAccessToken()).isEqualTo("token-1");
        assertThat(result.getValue().getTokenType()).isEqualTo("bearer");
        assertThat(result.getValue().getUserName()).isEqualTo("Ann");
    }

    @Test
    void wrongPasswordAndUnknownEmailFailWithTheSameKind() {
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.of(ann()));
        when(passwordHasher.verify("wrong", HASH)).thenReturn(false);
        when(credentialStore.findUserByEmail("nobody@x.com")).thenReturn(Optional.empty());
        when(passwordHasher.verify("secret123", AuthService.UNKNOWN_USER_HASH)).thenReturn(false);

        AuthResult<LoginResponse> wrongPassword = authService.login(new LoginRequest("ann@x.com", "wrong"));
        AuthResult<LoginResponse> unknownEmail = authService.login(new LoginRequest("nobody@x.com", "secret123"));

        assertThat(wrongPassword.getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        assertThat(unknownEmail.getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        verify(tokenService, never()).createToken(anyString());
    }

    @Test
    void unknownEmailStillRunsPasswordVerification() {
        when(credentialStore.findUserByEmail("nobody@x.com")).thenReturn(Optional.empty());

        AuthResult<LoginResponse> result = authService.login(new LoginRequest("nobody@x.com", "secret123"));

        assertThat(result.getError()).isEqualTo(AuthError.UNAUTHENTICATED);
        verify(passwordHasher).verify("secret123", AuthService.UNKNOWN_USER_HASH);
    }

    @Test
    void placeholderHashForUnknownEmailIsAcceptedByBcrypt() {
        PasswordHasher bcrypt = new BCryptPasswordHasher(new BCryptPasswordEncoder());

        assertThat(bcrypt.verify("secret123", AuthService.UNKNOWN_USER_HASH)).isFalse();
    }

    @Test
    void loginPropagatesMalformedStoredHashAsInternalFailure() {
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.of(ann()));
        when(passwordHasher.verify("secret123", HASH))
                .thenThrow(new PasswordVerificationException("Stored password hash is malformed"));

        assertThatThrownBy(() -> authService.login(new LoginRequest("ann@x.com", "secret123")))
                .isInstanceOf(PasswordVerificationException.class);
    }

    @Test
    void registerHashesAndStoresUser() {
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.empty());
        when(passwordHasher.hash("secret123")).thenReturn(HASH);
        when(credentialStore.insertUser("Ann", "ann@x.com", HASH)).thenReturn(ann());

        AuthResult<MessageResponse> result =
                authService.register(new SignupRequest("Ann", "ann@x.com", "secret123"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().message()).isEqualTo("User registered successfully");
        verify(tokenService, never()).createToken(anyString());
    }

    @Test
    void registerFailsWithConflictForKnownEmail() {
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.of(ann()));

        AuthResult<MessageResponse> result =
                authService.register(new SignupRequest("Other", "ann@x.com", "secret123"));

        assertThat(result.getError()).isEqualTo(AuthError.CONFLICT);
        verify(credentialStore, never()).insertUser(any(), any(), any());
        verify(passwordHasher, never()).hash(any());
    }

    @Test
    void registerFailsWithConflictWhenStoreRejectsDuplicate() {
        when(credentialStore.findUserByEmail("ann@x.com")).thenReturn(Optional.empty());
        when(passwordHasher.hash("secret123")).thenReturn(HASH);
        when(credentialStore.insertUser("Ann", "ann@x.com", HASH))
                .thenThrow(new EmailAlreadyRegisteredException("ann@x.com", null));

        AuthResult<MessageResponse> result =
                authService.register(new SignupRequest("Ann", "ann@x.com", "secret123"));

        assertThat(result.getError()).isEqualTo(AuthError.CONFLICT);
    }

    private static User ann() {
        User user = new User();
        user.setId("u-1");
        user.setName("Ann");
        user.setEmail("ann@x.com");
        user.setPasswordHash(HASH);
        return user;
    }
}
