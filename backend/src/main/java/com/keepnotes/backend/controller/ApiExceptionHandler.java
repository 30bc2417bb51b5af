package com.keepnotes.backend.controller;

import com.keepnotes.backend.dto.ApiErrorResponse;
import com.keepnotes.backend.service.NoteNotFoundException;
import com.keepnotes.backend.service.PasswordHashingException;
import com.keepnotes.backend.service.PasswordVerificationException;
import com.keepnotes.backend.service.TokenSigningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to {@link ApiErrorResponse}. Internal failures are logged in full and answered with
 * a generic message.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String INTERNAL_MESSAGE = "Internal Server Error";

    // covers MethodArgumentNotValidException too
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(BindException ex) {
        FieldError fieldError = ex.getFieldError();
        String message = fieldError == null
                ? "invalid request"
                : fieldError.getField() + " " + fieldError.getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ApiErrorResponse("BAD_REQUEST", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse("BAD_REQUEST", "malformed request body"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(new ApiErrorResponse("UNSUPPORTED_MEDIA_TYPE", ex.getMessage()));
    }

    @ExceptionHandler(NoteNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoteNotFound(NoteNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiErrorResponse("NOT_FOUND", "Note not found or not authorized"));
    }

    @ExceptionHandler({
            PasswordHashingException.class,
            PasswordVerificationException.class,
            TokenSigningException.class,
            DataAccessException.class
    })
    public ResponseEntity<ApiErrorResponse> handleInternal(RuntimeException ex) {
        log.error("request failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", INTERNAL_MESSAGE));
    }
}
