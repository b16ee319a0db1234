package com.storefront.authservice.dto;

import com.storefront.authservice.entity.User;
import com.storefront.authservice.entity.UserRole;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of an identity. Never carries the password hash.
 */
public record IdentityRecord(UUID id,
                             String email,
                             UserRole role,
                             boolean active,
                             boolean emailVerified,
                             String firstName,
                             String lastName,
                             Instant lastLoginAt,
                             Instant lastActiveAt) {

    public static IdentityRecord from(User user) {
        return new IdentityRecord(
                user.getId(),
                user.getEmail(),
                user.getRole(),
                user.isActive(),
                user.isEmailVerified(),
                user.getFirstName(),
                user.getLastName(),
                user.getLastLoginAt(),
                user.getLastActiveAt());
    }
}
