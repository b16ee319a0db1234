package com.storefront.authservice.SecurityConfig;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

public class IdentityAuthentication extends AbstractAuthenticationToken {

    private final AuthenticatedIdentity identity;
    private final transient TokenClaims claims;
    private final String token;

    public IdentityAuthentication(AuthenticatedIdentity identity, TokenClaims claims, String token) {
        super(List.of(new SimpleGrantedAuthority(identity.role().authority())));
        this.identity = identity;
        this.claims = claims;
        this.token = token;
        setAuthenticated(true);
    }

    @Override
    public AuthenticatedIdentity getPrincipal() {
        return identity;
    }

    /** The raw bearer token; needed by logout to revoke it. */
    @Override
    public String getCredentials() {
        return token;
    }

    public AuthenticatedIdentity getIdentity() {
        return identity;
    }

    public TokenClaims getClaims() {
        return claims;
    }

    @Override
    public String getName() {
        return identity.email();
    }
}
