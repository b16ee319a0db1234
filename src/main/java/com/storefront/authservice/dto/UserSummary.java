package com.storefront.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storefront.authservice.entity.UserRole;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private UUID id;
    private String email;
    private String displayName;
    private UserRole role;
    private boolean active;
    private boolean emailVerified;
    private Instant lastLoginAt;

    public static UserSummary of(IdentityRecord identity) {
        return UserSummary.builder()
                .id(identity.id())
                .email(identity.email())
                .displayName(displayName(identity))
                .role(identity.role())
                .active(identity.active())
                .emailVerified(identity.emailVerified())
                .lastLoginAt(identity.lastLoginAt())
                .build();
    }

    private static String displayName(IdentityRecord identity) {
        String first = identity.firstName() == null ? "" : identity.firstName().trim();
        String last = identity.lastName() == null ? "" : identity.lastName().trim();
        String full = (first + " " + last).trim();
        return full.isEmpty() ? null : full;
    }
}
