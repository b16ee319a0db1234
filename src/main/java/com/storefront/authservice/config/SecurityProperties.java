package com.storefront.authservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of {@code app.security.*}.
 * <p>
 * The {@link Authentication} block is the single switchboard for the request filter; the
 * stores behind the lockout guard and the revocation list are selected with {@link #store}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.security")
public class SecurityProperties {

    /** Backing store for login attempts and revoked tokens. */
    private StoreType store = StoreType.MEMORY;

    /** How often stale lockout records and revoked-token entries are evicted. */
    private Duration sweepInterval = Duration.ofHours(1);

    private Token token = new Token();
    private Authentication authentication = new Authentication();
    private Revocation revocation = new Revocation();
    private AccountLockout accountLockout = new AccountLockout();
    private Password password = new Password();
    private Cors cors = new Cors();

    public enum StoreType { MEMORY, REDIS }

    @Getter
    @Setter
    public static class Token {
        /** Raw signing secret, or {@code base64:<value>}. Required, at least 32 bytes. */
        private String secret;
        private Duration ttl = Duration.ofDays(7);
        /** Tolerated clock drift for exp / nbf / iat checks. */
        private Duration clockSkew = Duration.ofSeconds(30);
        /** Enforced only when set. */
        private String issuer;
        private String audience;
    }

    @Getter
    @Setter
    public static class Authentication {
        private boolean requireEmailVerification = false;
        private boolean allowCookieToken = true;
        private String cookieName = "token";
        private boolean enableIpLockout = true;
        private int lockoutThreshold = 10;
        private Duration lockoutWindow = Duration.ofHours(1);
        /** Honour X-Forwarded-For when resolving the client address (only behind a trusted proxy). */
        private boolean trustForwardedFor = false;
    }

    @Getter
    @Setter
    public static class Revocation {
        /** Kept past the token's own expiry before the entry may be forgotten. */
        private Duration retentionMargin = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class AccountLockout {
        private boolean enabled = true;
        private int threshold = 5;
        private Duration duration = Duration.ofHours(2);
    }

    @Getter
    @Setter
    public static class Password {
        /** BCrypt work factor. */
        private int strength = 12;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
