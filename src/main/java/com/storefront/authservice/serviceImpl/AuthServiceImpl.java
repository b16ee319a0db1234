package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.SecurityConfig.IdentityAuthentication;
import com.storefront.authservice.SecurityConfig.IssuedToken;
import com.storefront.authservice.SecurityConfig.JwtTokenProviderConfig;
import com.storefront.authservice.SecurityConfig.LoginAttemptGuard;
import com.storefront.authservice.SecurityConfig.TokenBlacklistConfig;
import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.dto.*;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.AuthReason;
import com.storefront.authservice.service.AccountLockoutService;
import com.storefront.authservice.service.AuthService;
import com.storefront.authservice.service.CredentialHasher;
import com.storefront.authservice.service.IdentityActivityService;
import com.storefront.authservice.service.IdentityLookup;
import com.storefront.authservice.utils.RequestMetadata;
import com.storefront.authservice.utils.TokenDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Credential login and logout. Not transactional as a whole: each counter update commits on its
 * own so that a failed login is counted even though the call ends in an exception.
 */
@Slf4j
@Service
public class AuthServiceImpl implements AuthService {

    private static final String INVALID_CREDENTIALS = "Invalid email or password.";

    private final IdentityLookup identities;
    private final CredentialHasher hasher;
    private final LoginAttemptGuard guard;
    private final AccountLockoutService accountLockout;
    private final JwtTokenProviderConfig tokens;
    private final TokenBlacklistConfig blacklist;
    private final IdentityActivityService activity;
    private final SecurityProperties.Authentication config;

    /** Verified against for unknown emails so both paths cost one hash. */
    private final String dummyHash;

    public AuthServiceImpl(IdentityLookup identities,
                           CredentialHasher hasher,
                           LoginAttemptGuard guard,
                           AccountLockoutService accountLockout,
                           JwtTokenProviderConfig tokens,
                           TokenBlacklistConfig blacklist,
                           IdentityActivityService activity,
                           SecurityProperties props) {
        this.identities = identities;
        this.hasher = hasher;
        this.guard = guard;
        this.accountLockout = accountLockout;
        this.tokens = tokens;
        this.blacklist = blacklist;
        this.activity = activity;
        this.config = props.getAuthentication();
        this.dummyHash = hasher.hash(UUID.randomUUID().toString());
    }

    @Override
    public LoginResponse login(LoginRequest request, RequestMetadata.ClientInfo client) {
        final String source = client != null ? client.ip() : "unknown";
        final String password = Objects.requireNonNullElse(request.getPassword(), "");

        if (config.isEnableIpLockout() && guard.isBlocked(source)) {
            log.warn("Login refused for blocked source {}", source);
            throw new AuthExceptions.RateLimited(AuthReason.IP_BLOCKED,
                    guard.retryAfter(source).orElse(null), guard.blockedUntil(source).orElse(null));
        }

        final String email = IdentityLookup.normalizeEmail(request.getEmail());
        CredentialRecord credentials;
        try {
            credentials = identities.findCredentialsByEmail(email).orElse(null);
        } catch (DataAccessException e) {
            throw new AuthExceptions.PersistenceUnavailable("Identity store unavailable.", e);
        }

        if (credentials == null) {
            hasher.verify(password, dummyHash);
            recordSourceFailure(source);
            log.info("Login failed for unknown email from {}", source);
            throw new AuthExceptions.Unauthenticated(AuthReason.INVALID_CREDENTIALS, INVALID_CREDENTIALS);
        }

        IdentityRecord identity = credentials.identity();
        boolean passwordMatches = hasher.verify(password, credentials.passwordHash());
        try {
            accountLockout.ensureNotLocked(identity.id());
        } catch (AuthExceptions.RateLimited locked) {
            recordSourceFailure(source);
            log.info("Login refused for locked account {}", identity.id());
            if (!passwordMatches) {
                // Same answer as an unknown email; the lock is only disclosed to the owner.
                throw new AuthExceptions.Unauthenticated(AuthReason.INVALID_CREDENTIALS, INVALID_CREDENTIALS);
            }
            throw locked;
        }

        if (!passwordMatches) {
            recordSourceFailure(source);
            accountLockout.recordFailure(identity.id());
            log.info("Login failed for {} from {}", identity.id(), source);
            throw new AuthExceptions.Unauthenticated(AuthReason.INVALID_CREDENTIALS, INVALID_CREDENTIALS);
        }

        // Correct password from here on.
        guard.reset(source);
        accountLockout.reset(identity.id());

        if (!identity.active()) {
            throw new AuthExceptions.Forbidden(AuthReason.ACCOUNT_DEACTIVATED, "Account has been deactivated.");
        }
        if (config.isRequireEmailVerification() && !identity.emailVerified()) {
            throw new AuthExceptions.Forbidden(AuthReason.VERIFICATION_REQUIRED, "Email verification required.");
        }

        IssuedToken issued = tokens.issue(identity.id(), identity.role(), Map.of("email", identity.email()));
        activity.recordLogin(identity.id(), client);
        log.info("Login success for {} ({})", identity.id(), identity.role());

        return LoginResponse.builder()
                .accessToken(issued.token())
                .expiresIn(tokens.getTokenTtl().toSeconds())
                .issuedAt(issued.issuedAt())
                .expiresAt(issued.expiresAt())
                .user(UserSummary.of(identity))
                .build();
    }

    @Override
    public void logout(String token) {
        if (token == null || token.isBlank()) {
            log.debug("Logout without a token");
            return;
        }
        blacklist.revoke(token);
        log.info("Logout for token {}", TokenDigest.shortId(token));
    }

    @Override
    public SessionResponse currentSession(IdentityAuthentication authentication, boolean includeHistory) {
        UUID id = authentication.getIdentity().id();
        IdentityRecord identity = identities.findById(id)
                .orElseThrow(() -> new AuthExceptions.Unauthenticated(AuthReason.ACCOUNT_NOT_FOUND, "Account not found."));
        List<LoginHistoryEntry> history = includeHistory ? activity.recentLogins(id) : null;
        return SessionResponse.builder()
                .authenticated(true)
                .user(UserSummary.of(identity))
                .tokenRole(authentication.getIdentity().role())
                .tokenExpiresAt(authentication.getClaims() != null ? authentication.getClaims().expiresAt() : null)
                .recentLogins(history)
                .build();
    }

    private void recordSourceFailure(String source) {
        if (config.isEnableIpLockout()) {
            guard.recordFailure(source);
        }
    }
}
