package com.keepnotes.backend.service;

// Bad signature, wrong algorithm or an undecodable token.
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
