package com.keepnotes.backend.service;

// Also raised when the note exists but belongs to someone else.
public class NoteNotFoundException extends RuntimeException {

    public NoteNotFoundException(String noteId) {
        super("note not found: " + noteId);
    }
}
