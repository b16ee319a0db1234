package com.storefront.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storefront.authservice.entity.UserRole;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Current caller as seen by the server. {@code tokenRole} is the role baked into the token,
 * which can lag behind {@code user.role} until the next login.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {
    private boolean authenticated;
    private UserSummary user;
    private UserRole tokenRole;
    private Instant tokenExpiresAt;
    private List<LoginHistoryEntry> recentLogins;

    public static SessionResponse anonymous() {
        return SessionResponse.builder().authenticated(false).build();
    }
}
