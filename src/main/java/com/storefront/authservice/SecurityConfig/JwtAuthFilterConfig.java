package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.exception.AuthException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs {@link AuthenticationPipeline} for every request. A failure is never written here: it is
 * parked on the request so that open routes continue anonymously, while protected routes hand it
 * to {@link JwtAuthenticationEntryPoint}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilterConfig extends OncePerRequestFilter {

    /** Request attribute holding the {@link AuthException} of a failed attempt. */
    public static final String AUTH_FAILURE_ATTR = JwtAuthFilterConfig.class.getName() + ".FAILURE";

    private final AuthenticationPipeline pipeline;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                IdentityAuthentication auth = pipeline.authenticate(request);
                auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                securityContext.setAuthentication(auth);
                SecurityContextHolder.setContext(securityContext);
            } catch (AuthException ex) {
                request.setAttribute(AUTH_FAILURE_ATTR, ex);
                log.debug("Authentication failed on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.code());
            }
        }

        filterChain.doFilter(request, response);
    }
}
