package com.storefront.authservice.utils;

import com.storefront.authservice.SecurityConfig.IdentityAuthentication;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * created_by / modified_by: {@code ADMIN:<email>} or {@code USER:<email>} for authenticated
 * callers, {@code SYSTEM} for registration, bootstrap and background writes.
 */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    private static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        if (auth instanceof IdentityAuthentication identity && identity.isAuthenticated()) {
            var principal = identity.getIdentity();
            String prefix = switch (principal.role()) {
                case ADMIN, SUPERADMIN -> "ADMIN";
                case USER -> "USER";
            };
            return Optional.of(prefix + ":" + principal.email());
        }
        return Optional.of(SYSTEM);
    }
}
