package com.keepnotes.backend.dto;

/**
 * The caller behind a validated bearer token, looked up fresh for each request.
 */
public record ResolvedIdentity(String id, String name, String email) {
}
