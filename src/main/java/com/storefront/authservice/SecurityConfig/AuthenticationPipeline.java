package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.dto.IdentityRecord;
import com.storefront.authservice.exception.AuthException;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.AuthReason;
import com.storefront.authservice.service.IdentityActivityService;
import com.storefront.authservice.service.IdentityLookup;
import com.storefront.authservice.utils.RequestMetadata;
import com.storefront.authservice.utils.TokenDigest;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.Arrays;
import java.util.Optional;

/**
 * The single authentication routine behind the request filter. Steps run in a fixed order and
 * the first failure wins:
 * <ol>
 *   <li>source address blocked by the lockout guard (when enabled)</li>
 *   <li>bearer token, falling back to the cookie (when enabled)</li>
 *   <li>revocation list</li>
 *   <li>signature and time claims</li>
 *   <li>identity lookup</li>
 *   <li>active flag</li>
 *   <li>email verification (when required)</li>
 * </ol>
 * On success the last-active timestamp is updated in the background.
 */
@Slf4j
@Component
public class AuthenticationPipeline {

    private static final String BEARER = "Bearer ";

    private final LoginAttemptGuard guard;
    private final TokenBlacklistConfig blacklist;
    private final JwtTokenProviderConfig tokens;
    private final IdentityLookup identities;
    private final IdentityActivityService activity;
    private final RequestMetadata requestMetadata;
    private final SecurityProperties.Authentication config;

    public AuthenticationPipeline(LoginAttemptGuard guard,
                                  TokenBlacklistConfig blacklist,
                                  JwtTokenProviderConfig tokens,
                                  IdentityLookup identities,
                                  IdentityActivityService activity,
                                  RequestMetadata requestMetadata,
                                  SecurityProperties props) {
        this.guard = guard;
        this.blacklist = blacklist;
        this.tokens = tokens;
        this.identities = identities;
        this.activity = activity;
        this.requestMetadata = requestMetadata;
        this.config = props.getAuthentication();
    }

    /**
     * @throws AuthException describing the first failed step
     */
    public IdentityAuthentication authenticate(HttpServletRequest request) {
        if (config.isEnableIpLockout()) {
            String source = requestMetadata.clientIp(request);
            if (guard.isBlocked(source)) {
                log.debug("Rejecting request from blocked source {}", source);
                throw new AuthExceptions.RateLimited(AuthReason.IP_BLOCKED,
                        guard.retryAfter(source).orElse(null),
                        guard.blockedUntil(source).orElse(null));
            }
        }

        String token = resolveToken(request)
                .orElseThrow(() -> new AuthExceptions.Unauthenticated(AuthReason.NO_TOKEN,
                        "Authentication is required to access this resource."));

        if (blacklist.isRevoked(token)) {
            log.debug("Revoked token {} presented", TokenDigest.shortId(token));
            throw new AuthExceptions.Revoked();
        }

        TokenClaims claims = tokens.verify(token);

        IdentityRecord identity;
        try {
            identity = identities.findById(claims.identityId())
                    .orElseThrow(() -> new AuthExceptions.Unauthenticated(AuthReason.ACCOUNT_NOT_FOUND,
                            "Account not found."));
        } catch (DataAccessException | TransactionException e) {
            log.error("Identity lookup failed for {}: {}", claims.identityId(), e.toString());
            throw new AuthExceptions.PersistenceUnavailable("Identity store unavailable.", e);
        }

        if (!identity.active()) {
            throw new AuthExceptions.Forbidden(AuthReason.ACCOUNT_DEACTIVATED, "Account has been deactivated.");
        }
        if (config.isRequireEmailVerification() && !identity.emailVerified()) {
            throw new AuthExceptions.Forbidden(AuthReason.VERIFICATION_REQUIRED, "Email verification required.");
        }

        try {
            activity.touch(identity.id());
        } catch (RuntimeException e) {
            log.debug("Last-active update not scheduled for {}: {}", identity.id(), e.toString());
        }

        AuthenticatedIdentity principal = new AuthenticatedIdentity(
                identity.id(), identity.email(), claims.role(), identity.emailVerified());
        return new IdentityAuthentication(principal, claims, token);
    }

    /** Bearer header first; cookie only when allowed. Blank values count as absent. */
    public Optional<String> resolveToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            String value = header.substring(BEARER.length()).trim();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        if (config.isAllowCookieToken() && request.getCookies() != null) {
            return Arrays.stream(request.getCookies())
                    .filter(c -> config.getCookieName().equals(c.getName()))
                    .map(Cookie::getValue)
                    .filter(v -> v != null && !v.isBlank())
                    .findFirst();
        }
        return Optional.empty();
    }
}
