package com.keepnotes.backend.service;

import java.util.Objects;

/**
 * Either a value or an {@link AuthError}. The failure reason is internal and only meant for logs;
 * responses must not echo it.
 */
public final class AuthResult<T> {

    private final T value;
    private final AuthError error;
    private final String reason;

    private AuthResult(T value, AuthError error, String reason) {
        this.value = value;
        this.error = error;
        this.reason = reason;
    }

    public static <T> AuthResult<T> success(T value) {
        return new AuthResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> AuthResult<T> failure(AuthError error, String reason) {
        return new AuthResult<>(null, Objects.requireNonNull(error, "error"), reason);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("no value on failed result: " + error);
        }
        return value;
    }

    public AuthError getError() {
        return error;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AuthResult[success]" : "AuthResult[" + error + ": " + reason + "]";
    }
}
