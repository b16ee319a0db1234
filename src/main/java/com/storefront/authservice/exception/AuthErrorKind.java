package com.storefront.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Closed set of per-request authentication/authorization failures.
 * Callers switch over this instead of inspecting exception types or messages.
 */
public enum AuthErrorKind {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "unauthorized", "Unauthorized"),
    EXPIRED(HttpStatus.UNAUTHORIZED, "token-expired", "Session Expired"),
    REVOKED(HttpStatus.UNAUTHORIZED, "token-revoked", "Token Revoked"),
    MALFORMED(HttpStatus.UNAUTHORIZED, "invalid-token", "Invalid Token"),
    NOT_YET_VALID(HttpStatus.UNAUTHORIZED, "token-not-yet-valid", "Token Not Yet Valid"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate-limited", "Too Many Requests"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "forbidden", "Forbidden"),
    PERSISTENCE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "persistence-unavailable", "Service Unavailable");

    private static final String PROBLEM_BASE = "https://storefront.dev/problems/";

    private final HttpStatus status;
    private final String slug;
    private final String title;

    AuthErrorKind(HttpStatus status, String slug, String title) {
        this.status = status;
        this.slug = slug;
        this.title = title;
    }

    public HttpStatus status() { return status; }

    public String type() { return PROBLEM_BASE + slug; }

    public String title() { return title; }

    /** True for kinds where the client should drop its token and log in again. */
    public boolean requiresLogin() {
        return switch (this) {
            case UNAUTHENTICATED, EXPIRED, REVOKED, MALFORMED, NOT_YET_VALID -> true;
            case RATE_LIMITED, FORBIDDEN, PERSISTENCE_UNAVAILABLE -> false;
        };
    }
}
