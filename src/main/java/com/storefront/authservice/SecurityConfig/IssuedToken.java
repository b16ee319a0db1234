package com.storefront.authservice.SecurityConfig;

import java.time.Instant;

public record IssuedToken(String token, Instant issuedAt, Instant expiresAt, String tokenId) {
}
