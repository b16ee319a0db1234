package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.entity.UserRole;
import com.storefront.authservice.exception.AuthErrorKind;
import com.storefront.authservice.exception.AuthException;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.ConfigurationException;
import com.storefront.authservice.support.MutableClock;
import com.storefront.authservice.support.TestSecurityProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderConfigTest {

    private MutableClock clock;
    private SecurityProperties props;
    private JwtTokenProviderConfig tokens;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        props = TestSecurityProperties.defaults();
        tokens = newService(props);
    }

    private JwtTokenProviderConfig newService(SecurityProperties p) {
        JwtTokenProviderConfig service = new JwtTokenProviderConfig(p, clock);
        service.init();
        return service;
    }

    @Test
    void issuedTokenVerifiesWithSameSubjectAndRole() {
        UUID id = UUID.randomUUID();

        IssuedToken issued = tokens.issue(id, UserRole.ADMIN, Map.of("email", "a@b.test"));
        TokenClaims claims = tokens.verify(issued.token());

        assertThat(claims.identityId()).isEqualTo(id);
        assertThat(claims.role()).isEqualTo(UserRole.ADMIN);
        assertThat(claims.tokenId()).isEqualTo(issued.tokenId());
        assertThat(claims.expiresAt()).isEqualTo(issued.issuedAt().plus(Duration.ofDays(7)));
        assertThat(claims.extra()).containsEntry("email", "a@b.test");
    }

    @Test
    void reservedClaimsFromCallerAreIgnored() {
        UUID id = UUID.randomUUID();

        IssuedToken issued = tokens.issue(id, UserRole.USER, Map.of("role", "superadmin", "sub", "someone-else"));
        TokenClaims claims = tokens.verify(issued.token());

        assertThat(claims.identityId()).isEqualTo(id);
        assertThat(claims.role()).isEqualTo(UserRole.USER);
    }

    @Test
    void expiredTokenFailsAsExpiredNotMalformed() {
        IssuedToken issued = tokens.issue(UUID.randomUUID(), UserRole.USER, Map.of());

        clock.advance(Duration.ofDays(7).plusMinutes(1));

        assertThatThrownBy(() -> tokens.verify(issued.token()))
                .isInstanceOf(AuthExceptions.Expired.class)
                .extracting(e -> ((AuthException) e).getKind())
                .isEqualTo(AuthErrorKind.EXPIRED);
    }

    @Test
    void expiryWithinClockSkewIsTolerated() {
        IssuedToken issued = tokens.issue(UUID.randomUUID(), UserRole.USER, Map.of());

        clock.advance(Duration.ofDays(7).plusSeconds(10));

        assertThat(tokens.verify(issued.token()).role()).isEqualTo(UserRole.USER);
    }

    @Test
    void tokenIssuedInTheFutureIsNotYetValid() {
        MutableClock ahead = MutableClock.startingAt("2025-01-01T01:00:00Z");
        JwtTokenProviderConfig skewed = new JwtTokenProviderConfig(props, ahead);
        skewed.init();
        IssuedToken fromTheFuture = skewed.issue(UUID.randomUUID(), UserRole.USER, Map.of());

        assertThatThrownBy(() -> tokens.verify(fromTheFuture.token()))
                .isInstanceOf(AuthExceptions.NotYetValid.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsMalformed() {
        SecurityProperties other = TestSecurityProperties.defaults();
        other.getToken().setSecret("another-secret-another-secret-another-secret");
        IssuedToken foreign = newService(other).issue(UUID.randomUUID(), UserRole.ADMIN, Map.of());

        assertThatThrownBy(() -> tokens.verify(foreign.token()))
                .isInstanceOf(AuthExceptions.Malformed.class);
    }

    @Test
    void garbageIsMalformed() {
        assertThatThrownBy(() -> tokens.verify("not.a.jwt"))
                .isInstanceOf(AuthExceptions.Malformed.class);
        assertThatThrownBy(() -> tokens.verify(""))
                .isInstanceOf(AuthExceptions.Malformed.class);
    }

    @Test
    void tokenWithoutRoleIsMalformed() {
        String token = Jwts.builder()
                .subject(UUID.randomUUID().toString())
                .issuedAt(Date.from(clock.instant()))
                .expiration(Date.from(clock.instant().plus(Duration.ofHours(1))))
                .signWith(key(TestSecurityProperties.SECRET), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> tokens.verify(token))
                .isInstanceOf(AuthExceptions.Malformed.class)
                .hasMessageContaining("role");
    }

    @Test
    void legacyUserIdClaimIsAcceptedWhenSubjectIsMissing() {
        UUID id = UUID.randomUUID();
        String token = Jwts.builder()
                .claim("userId", id.toString())
                .claim("role", "admin")
                .issuedAt(Date.from(clock.instant()))
                .expiration(Date.from(clock.instant().plus(Duration.ofHours(1))))
                .signWith(key(TestSecurityProperties.SECRET), Jwts.SIG.HS256)
                .compact();

        TokenClaims claims = tokens.verify(token);

        assertThat(claims.identityId()).isEqualTo(id);
        assertThat(claims.role()).isEqualTo(UserRole.ADMIN);
    }

    @Test
    void issuerIsEnforcedWhenConfigured() {
        IssuedToken withoutIssuer = tokens.issue(UUID.randomUUID(), UserRole.USER, Map.of());

        SecurityProperties strict = TestSecurityProperties.defaults();
        strict.getToken().setIssuer("storefront");
        JwtTokenProviderConfig strictTokens = newService(strict);

        assertThatThrownBy(() -> strictTokens.verify(withoutIssuer.token()))
                .isInstanceOf(AuthExceptions.Malformed.class);
        IssuedToken withIssuer = strictTokens.issue(UUID.randomUUID(), UserRole.USER, Map.of());
        assertThat(strictTokens.verify(withIssuer.token()).role()).isEqualTo(UserRole.USER);
    }

    @Test
    void missingSecretFailsAtStartup() {
        SecurityProperties p = TestSecurityProperties.defaults();
        p.getToken().setSecret(" ");

        assertThatThrownBy(() -> newService(p)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shortSecretFailsAtStartup() {
        SecurityProperties p = TestSecurityProperties.defaults();
        p.getToken().setSecret("too-short");

        assertThatThrownBy(() -> newService(p))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void base64SecretIsDecoded() {
        byte[] raw = new byte[48];
        for (int i = 0; i < raw.length; i++) raw[i] = (byte) i;
        SecurityProperties p = TestSecurityProperties.defaults();
        p.getToken().setSecret("base64:" + Base64.getEncoder().encodeToString(raw));

        JwtTokenProviderConfig b64 = newService(p);
        UUID id = UUID.randomUUID();

        assertThat(b64.verify(b64.issue(id, UserRole.USER, Map.of()).token()).identityId()).isEqualTo(id);
    }

    @Test
    void expiryOfReadsExpiredTokens() {
        IssuedToken issued = tokens.issue(UUID.randomUUID(), UserRole.USER, Map.of());
        clock.advance(Duration.ofDays(30));

        assertThat(tokens.expiryOf(issued.token())).contains(issued.expiresAt());
        assertThat(tokens.expiryOf("garbage")).isEmpty();
    }

    private static SecretKey key(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
