package com.keepnotes.backend.controller;

import com.keepnotes.backend.dto.NoteMutationResponse;
import com.keepnotes.backend.dto.NoteRequest;
import com.keepnotes.backend.dto.NoteResponse;
import com.keepnotes.backend.dto.NoteUpdateRequest;
import com.keepnotes.backend.dto.ResolvedIdentity;
import com.keepnotes.backend.entity.Note;
import com.keepnotes.backend.service.NoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;

    @PostMapping("/create_notes")
    public ResponseEntity<NoteMutationResponse> create(@Valid @RequestBody NoteRequest request) {
        Note note = noteService.create(currentUser().id(), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new NoteMutationResponse("Note created successfully", note.getId()));
    }

    @GetMapping("/fetch_all_notes")
    public List<NoteResponse> list() {
        return noteService.listForOwner(currentUser().id()).stream()
                .map(this::toResponse)
                .toList();
    }

    @PutMapping("/update_note/{noteId}")
    public NoteMutationResponse update(@PathVariable String noteId, @Valid @RequestBody NoteUpdateRequest request) {
        Note note = noteService.update(currentUser().id(), noteId, request);
        return new NoteMutationResponse("Note updated successfully", note.getId());
    }

    @DeleteMapping("/delete_note/{noteId}")
    public NoteMutationResponse delete(@PathVariable String noteId) {
        noteService.delete(currentUser().id(), noteId);
        return new NoteMutationResponse("Note deleted successfully", noteId);
    }

    private ResolvedIdentity currentUser() {
        var auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof ResolvedIdentity identity)) {
            throw new IllegalStateException("Unauthenticated");
        }
        return identity; // JwtAuthFilter principal
    }

    private NoteResponse toResponse(Note n) {
        return new NoteResponse(
                n.getId(),
                n.getUserId(),
                n.getTitle(),
                n.getContent(),
                n.getCreatedAt(),
                n.getUpdatedAt()
        );
    }
}
