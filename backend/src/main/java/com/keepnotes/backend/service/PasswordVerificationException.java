package com.keepnotes.backend.service;

// Stored hash is unusable. Not the same thing as a wrong password.
public class PasswordVerificationException extends RuntimeException {

    public PasswordVerificationException(String message) {
        super(message);
    }

    public PasswordVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
