package com.keepnotes.backend.service;

import com.keepnotes.backend.dto.LoginRequest;
import com.keepnotes.backend.dto.LoginResponse;
import com.keepnotes.backend.dto.MessageResponse;
import com.keepnotes.backend.dto.SignupRequest;
import com.keepnotes.backend.entity.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String TOKEN_TYPE = "bearer";

    // well-formed cost-10 bcrypt hash that no password is expected to match
    static final String UNKNOWN_USER_HASH = "$2a$10$7EqJtq98hPqEX7fNZaFWoOhi5BWX4Z3Z0pQxQ7n0m3ZlZ9m3lZ2iK";

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;

    /**
     * Unknown email and wrong password fail the same way; only the log line tells them apart.
     */
    public AuthResult<LoginResponse> login(LoginRequest request) {
        Optional<User> found = credentialStore.findUserByEmail(request.getUsername());
        if (found.isEmpty()) {
            // same bcrypt cost as a known email
            passwordHasher.verify(request.getPassword(), UNKNOWN_USER_HASH);
            log.info("login rejected for {}: unknown email", request.getUsername());
            return AuthResult.failure(AuthError.UNAUTHENTICATED, "unknown email");
        }

        User user = found.get();
        if (!passwordHasher.verify(request.getPassword(), user.getPasswordHash())) {
            log.info("login rejected for {}: wrong password", request.getUsername());
            return AuthResult.failure(AuthError.UNAUTHENTICATED, "wrong password");
        }

        String token = tokenService.createToken(user.getEmail());
        log.info("login succeeded for {}", user.getEmail());
        return AuthResult.success(new LoginResponse(token, TOKEN_TYPE, user.getName()));
    }

    /**
     * Registers a user. No token is issued; the caller logs in afterwards.
     */
    public AuthResult<MessageResponse> register(SignupRequest request) {
        String email = request.getUserEmail();
        if (credentialStore.findUserByEmail(email).isPresent()) {
            log.info("registration rejected for {}: email already registered", email);
            return AuthResult.failure(AuthError.CONFLICT, "email already registered");
        }

        String hash = passwordHasher.hash(request.getPassword());
        try {
            credentialStore.insertUser(request.getUserName(), email, hash);
        } catch (EmailAlreadyRegisteredException e) {
            // lost a race with a concurrent signup for the same address
            log.info("registration rejected for {}: registered concurrently", email);
            return AuthResult.failure(AuthError.CONFLICT, "email registered concurrently");
        }
        log.info("registered user {}", email);
        return AuthResult.success(new MessageResponse("User registered successfully"));
    }
}
