package com.keepnotes.backend.controller;

import com.keepnotes.backend.dto.ApiErrorResponse;
import com.keepnotes.backend.dto.LoginRequest;
import com.keepnotes.backend.dto.LoginResponse;
import com.keepnotes.backend.dto.MessageResponse;
import com.keepnotes.backend.dto.SignupRequest;
import com.keepnotes.backend.service.AuthResult;
import com.keepnotes.backend.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
public class AuthController {

    static final String INVALID_CREDENTIALS = "Invalid username or password!";
    static final String EMAIL_REGISTERED = "Email already registered";

    private final AuthService authService;

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<?> login(@Valid @ModelAttribute LoginRequest request) {
        AuthResult<LoginResponse> result = authService.login(request);
        if (!result.isSuccess()) {
            // unknown email and wrong password answer identically
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ApiErrorResponse("INVALID_CREDENTIALS", INVALID_CREDENTIALS));
        }
        return ResponseEntity.ok(result.getValue());
    }

    @PostMapping(value = "/signup", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> signup(@Valid @RequestBody SignupRequest request) {
        AuthResult<MessageResponse> result = authService.register(request);
        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ApiErrorResponse("CONFLICT", EMAIL_REGISTERED));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result.getValue());
    }
}
