package com.storefront.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Lightweight base exception carrying HTTP semantics for RFC 7807 responses.
 * Throw these from services/controllers/filters; GlobalExceptionHandler and the
 * security entry points map them through ErrorResponseWriter.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String type;   // e.g., https://storefront.dev/problems/not-found
    private final String title;  // short summary for ProblemDetail title

    protected ApiException(HttpStatus status, String type, String title, String detail) {
        super(detail);
        this.status = status;
        this.type = type;
        this.title = title;
    }

    /** Optional machine-readable error code (override if needed). */
    public String code() { return null; }

    /** Extra ProblemDetail members; must be safe to show to the client. */
    public Map<String, Object> properties() { return Map.of(); }
}
