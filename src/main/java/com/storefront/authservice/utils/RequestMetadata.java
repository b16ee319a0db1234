package com.storefront.authservice.utils;

import com.storefront.authservice.config.SecurityProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Client address and agent for lockout keys and login history.
 * {@code X-Forwarded-For} is honoured only with {@code app.security.authentication.trust-forwarded-for}.
 */
@Component
public class RequestMetadata {

    private static final int MAX_AGENT = 255;

    private final boolean trustForwardedFor;

    public RequestMetadata(SecurityProperties props) {
        this.trustForwardedFor = props.getAuthentication().isTrustForwardedFor();
    }

    public String clientIp(HttpServletRequest request) {
        if (trustForwardedFor) {
            String xf = request.getHeader("X-Forwarded-For");
            if (xf != null && !xf.isBlank()) {
                String first = xf.split(",")[0].trim();
                if (!first.isEmpty()) return first;
            }
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? "unknown" : remote;
    }

    public String userAgent(HttpServletRequest request) {
        String ua = request.getHeader("User-Agent");
        if (ua == null) return null;
        return ua.length() > MAX_AGENT ? ua.substring(0, MAX_AGENT) : ua;
    }

    public ClientInfo describe(HttpServletRequest request) {
        return new ClientInfo(clientIp(request), userAgent(request));
    }

    public record ClientInfo(String ip, String userAgent) {
    }
}
