package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.exception.AuthException;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.AuthReason;
import com.storefront.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Rejects a protected request that reached the authorization check without an identity.
 * The status follows the parked pipeline failure: 401, 403 (deactivated/unverified),
 * 429 (blocked source) or 500 (store outage).
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        AuthException failure = request.getAttribute(JwtAuthFilterConfig.AUTH_FAILURE_ATTR) instanceof AuthException ex
                ? ex
                : new AuthExceptions.Unauthenticated(AuthReason.NO_TOKEN,
                        "Authentication is required to access this resource.");

        log.debug("Rejected {} {} with {}", request.getMethod(), request.getRequestURI(), failure.code());
        writer.write(request, response, failure);
    }
}
