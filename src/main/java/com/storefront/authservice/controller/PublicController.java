package com.storefront.authservice.controller;

import com.storefront.authservice.SecurityConfig.IdentityAuthentication;
import com.storefront.authservice.dto.SessionResponse;
import com.storefront.authservice.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Open routes. A valid token personalises the answer; a missing or bad one never fails the request.
 */
@RestController
@RequestMapping("/public")
@RequiredArgsConstructor
@Tag(name = "Public")
public class PublicController {

    private final AuthService authService;

    @GetMapping("/session")
    @Operation(summary = "Who is calling, if anyone")
    public SessionResponse session() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof IdentityAuthentication identity) {
            return authService.currentSession(identity, false);
        }
        return SessionResponse.anonymous();
    }
}
