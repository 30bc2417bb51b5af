package com.keepnotes.backend.dto;

public record NoteMutationResponse(String message, String noteId) {
}
