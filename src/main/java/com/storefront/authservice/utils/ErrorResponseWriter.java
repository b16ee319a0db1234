package com.storefront.authservice.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.authservice.exception.ApiException;
import com.storefront.authservice.exception.AuthException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Writes RFC 7807 problem bodies straight to the servlet response. Shared by the MVC
 * exception handler and the security entry points, which run outside the dispatcher.
 */
@Component
public class ErrorResponseWriter {

    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull ApiException ex) throws IOException {
        String detail = ex.getMessage() == null || ex.getMessage().isBlank()
                ? "Request could not be processed."
                : ex.getMessage();

        if (ex instanceof AuthException auth) {
            Duration retryAfter = auth.retryAfter();
            if (retryAfter != null && !resp.isCommitted()) {
                // Whole seconds, rounded up, never 0.
                long secs = Math.max(1, retryAfter.toSeconds() + (retryAfter.toNanosPart() > 0 ? 1 : 0));
                resp.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(secs));
            }
            if (ex.getStatus() == HttpStatus.UNAUTHORIZED && !resp.isCommitted()) {
                resp.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
            }
        }

        write(req, resp, ex.getStatus(), ex.getType(), ex.getTitle(), detail, ex.code(), ex.properties());
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,              // e.g. "https://storefront.dev/problems/unauthorized"
                      @NonNull String title,
                      @NonNull String detail) throws IOException {
        write(req, resp, status, type, title, detail, null, Map.of());
    }

    private void write(HttpServletRequest req,
                       HttpServletResponse resp,
                       HttpStatus status,
                       String type,
                       String title,
                       String detail,
                       String code,
                       Map<String, Object> properties) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = ProblemDetail.forStatus(status);
        if (type != null && !type.isBlank()) {
            pd.setType(URI.create(type));
        }
        pd.setTitle(title);
        pd.setDetail(detail);
        pd.setInstance(URI.create(req.getRequestURI()));

        pd.setProperty("timestamp", OffsetDateTime.now(clock).toString());
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("requestId", resolveRequestId(req));
        if (code != null) {
            pd.setProperty("code", code);
        }
        if (properties != null) {
            properties.forEach(pd::setProperty);
        }

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType("application/problem+json");

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }

    /** Echoes the caller's correlation id, if it sent one. */
    private String resolveRequestId(HttpServletRequest req) {
        String id = req.getHeader(REQUEST_ID_HEADER);
        return id == null || id.isBlank() ? null : id;
    }
}
