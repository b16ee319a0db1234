package com.storefront.authservice.exception;

import java.time.Duration;
import java.time.Instant;

/**
 * Concrete auth failures, one per {@link AuthErrorKind}.
 *
 * Conventions:
 *  - type:   https://storefront.dev/problems/<slug> (from the kind)
 *  - code:   the {@link AuthReason} name
 *  - detail: safe for clients; never carries roles, token material or stack details
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401: No credential, unknown account, or bad login credentials. */
    public static final class Unauthenticated extends AuthException {
        public Unauthenticated(AuthReason reason, String detail) {
            super(AuthErrorKind.UNAUTHENTICATED, reason, detail);
        }
    }

    /** 401: Signature valid, token past its expiry. */
    public static final class Expired extends AuthException {
        public Expired(Instant expiredAt) {
            super(AuthErrorKind.EXPIRED, AuthReason.TOKEN_EXPIRED, "Session expired. Please login again.");
            put("expiredAt", expiredAt != null ? expiredAt.toString() : null);
        }
    }

    /** 401: Token was revoked (logout) ahead of its expiry. */
    public static final class Revoked extends AuthException {
        public Revoked() {
            super(AuthErrorKind.REVOKED, AuthReason.TOKEN_REVOKED, "Token has been revoked. Please login again.");
        }
    }

    /** 401: Bad signature, unparseable payload or missing mandatory claims. */
    public static final class Malformed extends AuthException {
        public Malformed(String detail) {
            super(AuthErrorKind.MALFORMED, AuthReason.INVALID_TOKEN, detail);
        }
    }

    /** 401: Issued-at / not-before lies in the future relative to the server clock. */
    public static final class NotYetValid extends AuthException {
        public NotYetValid() {
            super(AuthErrorKind.NOT_YET_VALID, AuthReason.TOKEN_NOT_YET_VALID, "Token not yet valid.");
        }
    }

    /** 429: Source address or account temporarily blocked. */
    public static final class RateLimited extends AuthException {
        private final Duration retryAfter;

        public RateLimited(AuthReason reason, Duration retryAfter, Instant blockedUntil) {
            super(AuthErrorKind.RATE_LIMITED, reason, "Too many failed attempts. Access temporarily blocked.");
            this.retryAfter = retryAfter;
            put("retryAfterSeconds", retryAfter != null ? retryAfter.toSeconds() : null);
            put("blockedUntil", blockedUntil != null ? blockedUntil.toString() : null);
        }

        @Override
        public Duration retryAfter() {
            return retryAfter;
        }
    }

    /** 403: Authenticated, but not allowed (role, deactivated, unverified). */
    public static final class Forbidden extends AuthException {
        public Forbidden(AuthReason reason, String detail) {
            super(AuthErrorKind.FORBIDDEN, reason, detail);
        }
    }

    /** 500: Identity or store backend unreachable. Never conflated with "not found". */
    public static final class PersistenceUnavailable extends AuthException {
        public PersistenceUnavailable(String detail, Throwable cause) {
            super(AuthErrorKind.PERSISTENCE_UNAVAILABLE, AuthReason.PERSISTENCE_UNAVAILABLE, detail, cause);
        }
    }
}
