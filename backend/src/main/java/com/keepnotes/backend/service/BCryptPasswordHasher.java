package com.keepnotes.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Slf4j
@Component
@RequiredArgsConstructor
public class BCryptPasswordHasher implements PasswordHasher {

    // $2a$10$ + 22 chars salt + 31 chars checksum
    private static final Pattern BCRYPT_HASH = Pattern.compile("\\A\\$2(a|y|b)?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    @Override
    public String hash(String plaintext) {
        try {
            return passwordEncoder.encode(plaintext);
        } catch (RuntimeException e) {
            log.error("password hashing failed", e);
            throw new PasswordHashingException("Failed to hash password", e);
        }
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        // BCryptPasswordEncoder answers false for a malformed hash; surface it instead
        if (hash == null || !BCRYPT_HASH.matcher(hash).matches()) {
            throw new PasswordVerificationException("Stored password hash is malformed");
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (RuntimeException e) {
            log.error("password verification failed", e);
            throw new PasswordVerificationException("Failed to verify password", e);
        }
    }
}
