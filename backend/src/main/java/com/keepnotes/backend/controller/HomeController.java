package com.keepnotes.backend.controller;

import com.keepnotes.backend.dto.ResolvedIdentity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController {

    @PostMapping("/")
    public String home(@AuthenticationPrincipal ResolvedIdentity user) {
        return "Good Morning " + user.name() + "!";
    }
}
