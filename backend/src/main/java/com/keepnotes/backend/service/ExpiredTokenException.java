package com.keepnotes.backend.service;

public class ExpiredTokenException extends RuntimeException {

    public ExpiredTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
