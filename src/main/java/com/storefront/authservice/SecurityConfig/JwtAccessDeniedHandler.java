package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.AuthReason;
import com.storefront.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 403 Forbidden for authenticated requests that lack the required role.
 * The actual and required roles are logged by {@link RoleAuthorization}, never sent.
 */
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ErrorResponseWriter writer;

    public JwtAccessDeniedHandler(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void handle(@NonNull HttpServletRequest request,
                       @NonNull HttpServletResponse response,
                       @NonNull AccessDeniedException accessDeniedException) throws IOException {
        writer.write(request, response, new AuthExceptions.Forbidden(AuthReason.INSUFFICIENT_ROLE,
                "You do not have permission to access this resource."));
    }
}
