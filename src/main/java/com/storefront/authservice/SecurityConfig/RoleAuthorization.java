package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.entity.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Role gates for the filter chain. The only implication is SUPERADMIN satisfying an ADMIN
 * requirement; {@link #requireSuperAdmin()} accepts SUPERADMIN alone.
 */
@Slf4j
@Component
public class RoleAuthorization {

    public AuthorizationManager<RequestAuthorizationContext> requireRole(UserRole... roles) {
        Set<UserRole> allowed = expand(roles);
        return (authentication, context) -> new AuthorizationDecision(
                permits(authentication.get(), allowed, context != null ? context.getRequest().getRequestURI() : "-"));
    }

    public AuthorizationManager<RequestAuthorizationContext> requireAdmin() {
        return requireRole(UserRole.ADMIN);
    }

    public AuthorizationManager<RequestAuthorizationContext> requireSuperAdmin() {
        return requireRole(UserRole.SUPERADMIN);
    }

    /** Role set a requirement accepts after expansion. */
    public static Set<UserRole> expand(UserRole... roles) {
        if (roles == null || roles.length == 0) {
            throw new IllegalArgumentException("At least one role is required");
        }
        EnumSet<UserRole> allowed = EnumSet.copyOf(Arrays.asList(roles));
        if (allowed.contains(UserRole.ADMIN)) {
            allowed.add(UserRole.SUPERADMIN);
        }
        return Collections.unmodifiableSet(allowed);
    }

    boolean permits(Authentication authentication, Set<UserRole> allowed, String target) {
        if (!(authentication instanceof IdentityAuthentication auth) || !auth.isAuthenticated()) {
            // Anonymous: the entry point answers with 401.
            return false;
        }
        UserRole actual = auth.getIdentity().role();
        if (allowed.contains(actual)) {
            return true;
        }
        log.warn("Access denied to {} for {}: role={}, allowed={}", target, auth.getIdentity().id(), actual, allowed);
        return false;
    }
}
