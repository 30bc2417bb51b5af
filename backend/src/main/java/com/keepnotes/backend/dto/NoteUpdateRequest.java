package com.keepnotes.backend.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: null fields are left as they are.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NoteUpdateRequest {

    @Size(min = 1, max = 200)
    private String noteTitle;

    @Size(max = 500)
    private String noteContent;
}
