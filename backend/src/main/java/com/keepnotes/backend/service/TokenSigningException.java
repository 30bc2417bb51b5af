package com.keepnotes.backend.service;

public class TokenSigningException extends RuntimeException {

    public TokenSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
