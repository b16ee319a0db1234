package com.storefront.authservice.controller;

import com.storefront.authservice.SecurityConfig.AuthenticationPipeline;
import com.storefront.authservice.SecurityConfig.IdentityAuthentication;
import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.dto.*;
import com.storefront.authservice.service.AuthService;
import com.storefront.authservice.service.RegistrationService;
import com.storefront.authservice.utils.RequestMetadata;
import com.storefront.authservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication")
public class AuthController {

    private final AuthService authService;
    private final AuthenticationPipeline authenticationPipeline;
    private final RegistrationService registrationService;
    private final RequestMetadata requestMetadata;
    private final SecurityProperties props;

    @PostMapping("/register")
    @ResponseMessage("Registered")
    @Operation(summary = "Create a USER account")
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegistrationRequest request) {
        RegistrationResponse body = registrationService.registerUser(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/login")
    @ResponseMessage("Logged in")
    @Operation(summary = "Exchange email and password for an access token")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest servletRequest) {
        LoginResponse response = authService.login(request, requestMetadata.describe(servletRequest));

        ResponseEntity.BodyBuilder ok = ResponseEntity.ok();
        if (props.getAuthentication().isAllowCookieToken()) {
            ResponseCookie cookie = tokenCookie(response.getAccessToken(),
                    Duration.ofSeconds(response.getExpiresIn()), servletRequest.isSecure());
            ok.header(HttpHeaders.SET_COOKIE, cookie.toString());
        }
        return ok.body(response);
    }

    /**
     * Open route: an absent, expired or already revoked token still gets 200 and a cleared cookie.
     * A token that is present is revoked either way.
     */
    @PostMapping("/logout")
    @ResponseMessage("Logged out")
    @Operation(summary = "Revoke the presented token", security = @SecurityRequirement(name = "bearerAuth"))
    public ResponseEntity<Map<String, Object>> logout(HttpServletRequest servletRequest) {
        Authentication current = SecurityContextHolder.getContext().getAuthentication();
        Optional<String> token = current instanceof IdentityAuthentication identity
                ? Optional.of(identity.getCredentials())
                : authenticationPipeline.resolveToken(servletRequest);
        authService.logout(token.orElse(null));

        ResponseCookie clear = tokenCookie("", Duration.ZERO, servletRequest.isSecure());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, clear.toString())
                .body(Map.of("success", true));
    }

    @GetMapping("/me")
    @Operation(summary = "Current identity and recent logins", security = @SecurityRequirement(name = "bearerAuth"))
    public SessionResponse me(IdentityAuthentication authentication) {
        return authService.currentSession(authentication, true);
    }

    private ResponseCookie tokenCookie(String value, Duration maxAge, boolean secure) {
        return ResponseCookie.from(props.getAuthentication().getCookieName(), value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
