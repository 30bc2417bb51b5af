package com.keepnotes.backend.service;

import com.keepnotes.backend.dto.NoteRequest;
import com.keepnotes.backend.dto.NoteUpdateRequest;
import com.keepnotes.backend.entity.Note;
import com.keepnotes.backend.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class NoteService {

    private final NoteRepository noteRepository;

    @Transactional
    public Note create(String ownerId, NoteRequest request) {
        Note note = new Note();
        note.setUserId(ownerId);
        note.setTitle(request.getNoteTitle());
        note.setContent(request.getNoteContent());
        Note saved = noteRepository.save(note);
        log.debug("note {} created for user {}", saved.getId(), ownerId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Note> listForOwner(String ownerId) {
        return noteRepository.findAllByUserIdOrderByCreatedAtAsc(ownerId);
    }

    @Transactional
    public Note update(String ownerId, String noteId, NoteUpdateRequest request) {
        Note note = noteRepository.findByIdAndUserId(noteId, ownerId)
                .orElseThrow(() -> new NoteNotFoundException(noteId));
        if (request.getNoteTitle() != null) {
            note.setTitle(request.getNoteTitle());
        }
        if (request.getNoteContent() != null) {
            note.setContent(request.getNoteContent());
        }
        return noteRepository.save(note);
    }

    @Transactional
    public void delete(String ownerId, String noteId) {
        Note note = noteRepository.findByIdAndUserId(noteId, ownerId)
                .orElseThrow(() -> new NoteNotFoundException(noteId));
        noteRepository.delete(note);
        log.debug("note {} deleted for user {}", noteId, ownerId);
    }
}
