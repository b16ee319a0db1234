package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.entity.UserRole;

import java.io.Serial;
import java.io.Serializable;
import java.security.Principal;
import java.util.UUID;

/**
 * Principal attached to an authenticated request. {@code role} comes from the token, so a role
 * change only shows up after the identity logs in again.
 */
public record AuthenticatedIdentity(UUID id, String email, UserRole role, boolean emailVerified)
        implements Principal, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    @Override
    public String getName() {
        return email;
    }
}
