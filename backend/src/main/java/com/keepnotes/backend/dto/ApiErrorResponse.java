package com.keepnotes.backend.dto;

public record ApiErrorResponse(String code, String message) {
}
