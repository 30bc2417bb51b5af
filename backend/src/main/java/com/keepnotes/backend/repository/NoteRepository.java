package com.keepnotes.backend.repository;

import com.keepnotes.backend.entity.Note;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface NoteRepository extends JpaRepository<Note, String> {

    List<Note> findAllByUserIdOrderByCreatedAtAsc(String userId);

    Optional<Note> findByIdAndUserId(String id, String userId);
}
