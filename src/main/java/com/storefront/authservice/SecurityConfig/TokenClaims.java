package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.entity.UserRole;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Verified token payload. {@code role} is the snapshot taken at issue time.
 */
public record TokenClaims(UUID identityId,
                          UserRole role,
                          Instant issuedAt,
                          Instant expiresAt,
                          String tokenId,
                          Map<String, Object> extra) {
}
