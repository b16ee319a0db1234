package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.store.RevokedTokenStore;
import com.storefront.authservice.utils.TokenDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Logout blacklist keyed by SHA-256(token). Entries outlive the token by the configured
 * retention margin. A store outage fails closed: the request is refused rather than
 * letting a possibly revoked token through.
 */
@Slf4j
@Service
public class TokenBlacklistConfig {

    private final RevokedTokenStore store;
    private final JwtTokenProviderConfig tokens;
    private final Clock clock;
    private final Duration retentionMargin;

    public TokenBlacklistConfig(RevokedTokenStore store,
                                JwtTokenProviderConfig tokens,
                                SecurityProperties props,
                                Clock clock) {
        this.store = store;
        this.tokens = tokens;
        this.clock = clock;
        this.retentionMargin = props.getRevocation().getRetentionMargin();
    }

    /** Idempotent. Tokens that do not verify are still revoked, for a full TTL plus margin. */
    public void revoke(@NonNull String token) {
        if (token.isBlank()) return;
        Instant expiry = tokens.expiryOf(token)
                .orElseGet(() -> clock.instant().plus(tokens.getTokenTtl()));
        Instant evictAt = expiry.plus(retentionMargin);
        try {
            store.put(TokenDigest.sha256Url(token), evictAt);
            log.info("Token {} revoked until {}", TokenDigest.shortId(token), evictAt);
        } catch (DataAccessException dae) {
            throw new AuthExceptions.PersistenceUnavailable("Could not revoke token.", dae);
        }
    }

    public boolean isRevoked(@NonNull String token) {
        if (token.isBlank()) return false;
        try {
            return store.contains(TokenDigest.sha256Url(token), clock.instant());
        } catch (DataAccessException dae) {
            log.warn("Revocation store unavailable during check: {}", dae.toString());
            throw new AuthExceptions.PersistenceUnavailable("Could not verify token status.", dae);
        }
    }

    public int sweep() {
        return store.sweep(clock.instant());
    }
}
