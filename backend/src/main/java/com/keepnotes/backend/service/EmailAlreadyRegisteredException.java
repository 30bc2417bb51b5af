package com.keepnotes.backend.service;

public class EmailAlreadyRegisteredException extends RuntimeException {

    public EmailAlreadyRegisteredException(String email, Throwable cause) {
        super("email already registered: " + email, cause);
    }
}
