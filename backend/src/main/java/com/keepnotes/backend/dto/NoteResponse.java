package com.keepnotes.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class NoteResponse {
    private String noteId;
    private String userId;
    private String noteTitle;
    private String noteContent;
    private Instant createdOn;
    private Instant lastUpdate;
}
