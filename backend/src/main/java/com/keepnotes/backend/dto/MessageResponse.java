package com.keepnotes.backend.dto;

public record MessageResponse(String message) {
}
