package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.entity.UserRole;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.ConfigurationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Issues and verifies HS256 access tokens.
 * <p>
 * Payload: {@code sub} (identity id), {@code role} (wire name), {@code iat} = {@code nbf}, {@code exp},
 * {@code jti}, optional {@code iss}/{@code aud}, plus caller-supplied claims. Tokens minted by the
 * previous generation carried the id under {@code userId} or {@code id}; both are still read.
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    static final String ROLE_CLAIM = "role";
    private static final List<String> LEGACY_ID_CLAIMS = List.of("userId", "id");
    private static final Set<String> RESERVED = Set.of("sub", "iat", "nbf", "exp", "jti", "iss", "aud", ROLE_CLAIM);
    private static final String BASE64_PREFIX = "base64:";

    private final SecurityProperties.Token config;
    private final Clock clock;

    /** Cached signing key & parser for performance */
    private SecretKey signingKey;
    private JwtParser jwtParser;

    public JwtTokenProviderConfig(SecurityProperties props, Clock clock) {
        this.config = props.getToken();
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        byte[] keyBytes = decodeSecret(config.getSecret());
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < 32) {
            throw new ConfigurationException(
                    "app.security.token.secret is too short for HS256: need >= 32 bytes, got " + keyBytes.length);
        }
        signingKey = Keys.hmacShaKeyFor(keyBytes);

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(config.getClockSkew().toSeconds());

        if (hasText(config.getIssuer())) {
            parserBuilder = parserBuilder.requireIssuer(config.getIssuer());
        }
        if (hasText(config.getAudience())) {
            parserBuilder = parserBuilder.requireAudience(config.getAudience());
        }
        jwtParser = parserBuilder.build();
        log.info("Token service ready: ttl={}, skew={}, issuer={}",
                config.getTtl(), config.getClockSkew(), hasText(config.getIssuer()) ? config.getIssuer() : "-");
    }

    /**
     * Mint a token for {@code identityId} carrying {@code role}. Reserved claim names in
     * {@code claims} are ignored.
     */
    public IssuedToken issue(UUID identityId, UserRole role, Map<String, Object> claims) {
        Objects.requireNonNull(identityId, "identityId");
        Objects.requireNonNull(role, "role");

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(positive(config.getTtl()));
        String jti = UUID.randomUUID().toString().replace("-", "");

        Map<String, Object> extra = new LinkedHashMap<>();
        if (claims != null) {
            claims.forEach((k, v) -> {
                if (!RESERVED.contains(k) && !LEGACY_ID_CLAIMS.contains(k) && v != null) {
                    extra.put(k, v);
                }
            });
        }

        var builder = Jwts.builder()
                .claims(extra)
                .subject(identityId.toString())
                .claim(ROLE_CLAIM, role.wireName())
                .issuedAt(Date.from(issuedAt))
                .notBefore(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .id(jti);
        if (hasText(config.getIssuer())) {
            builder = builder.issuer(config.getIssuer());
        }
        if (hasText(config.getAudience())) {
            builder = builder.audience().add(config.getAudience()).and();
        }

        String token = builder.signWith(signingKey, Jwts.SIG.HS256).compact();
        return new IssuedToken(token, issuedAt, expiresAt, jti);
    }

    /**
     * Verify signature and time claims, then decode the payload.
     *
     * @throws AuthExceptions.Expired     signature valid, {@code exp} passed
     * @throws AuthExceptions.NotYetValid {@code nbf} or {@code iat} ahead of the clock beyond the skew
     * @throws AuthExceptions.Malformed   anything else: bad signature, garbage, missing subject or role
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthExceptions.Malformed("Token is empty.");
        }
        Claims claims;
        try {
            claims = jwtParser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            Date exp = e.getClaims() != null ? e.getClaims().getExpiration() : null;
            throw new AuthExceptions.Expired(exp != null ? exp.toInstant() : null);
        } catch (PrematureJwtException e) {
            throw new AuthExceptions.NotYetValid();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new AuthExceptions.Malformed("Invalid token.");
        }

        Instant now = clock.instant();
        Date iat = claims.getIssuedAt();
        if (iat != null && iat.toInstant().isAfter(now.plus(config.getClockSkew()))) {
            throw new AuthExceptions.NotYetValid();
        }

        UUID identityId = parseIdentityId(claims);
        UserRole role = UserRole.fromWire(claims.get(ROLE_CLAIM, String.class))
                .orElseThrow(() -> new AuthExceptions.Malformed("Token carries no valid role."));

        Map<String, Object> extra = new LinkedHashMap<>();
        claims.forEach((k, v) -> {
            if (!RESERVED.contains(k) && !LEGACY_ID_CLAIMS.contains(k)) {
                extra.put(k, v);
            }
        });

        Date exp = claims.getExpiration();
        return new TokenClaims(
                identityId,
                role,
                iat != null ? iat.toInstant() : null,
                exp != null ? exp.toInstant() : null,
                claims.getId(),
                Collections.unmodifiableMap(extra));
    }

    /**
     * Expiry of a token whose signature checks out, even if it already expired. Empty for
     * anything that does not verify.
     */
    public Optional<Instant> expiryOf(String token) {
        try {
            Date exp = jwtParser.parseSignedClaims(token).getPayload().getExpiration();
            return Optional.ofNullable(exp).map(Date::toInstant);
        } catch (ExpiredJwtException e) {
            return Optional.ofNullable(e.getClaims().getExpiration()).map(Date::toInstant);
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public Duration getTokenTtl() {
        return positive(config.getTtl());
    }

    // ---------- helpers ----------

    private UUID parseIdentityId(Claims claims) {
        String raw = claims.getSubject();
        if (!hasText(raw)) {
            raw = LEGACY_ID_CLAIMS.stream()
                    .map(name -> claims.get(name))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .filter(JwtTokenProviderConfig::hasText)
                    .findFirst()
                    .orElseThrow(() -> new AuthExceptions.Malformed("Token carries no subject."));
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthExceptions.Malformed("Token subject is not a valid identity id.");
        }
    }

    private static byte[] decodeSecret(String secret) {
        if (!hasText(secret)) {
            throw new ConfigurationException("app.security.token.secret must be set (raw or base64:<value>).");
        }
        String s = secret.trim();
        if (s.startsWith(BASE64_PREFIX)) {
            try {
                return Decoders.BASE64.decode(s.substring(BASE64_PREFIX.length()));
            } catch (RuntimeException e) {
                throw new ConfigurationException("app.security.token.secret is not valid Base64.", e);
            }
        }
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static Duration positive(Duration d) {
        return d == null || d.isNegative() || d.isZero() ? Duration.ofDays(7) : d;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
