package com.storefront.authservice.bootstrap;

import com.storefront.authservice.entity.User;
import com.storefront.authservice.entity.UserRole;
import com.storefront.authservice.repository.UserRepository;
import com.storefront.authservice.service.CredentialHasher;
import com.storefront.authservice.service.IdentityLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Seeds one SUPERADMIN when {@code app.init.superadmin.email} and {@code .password} are set.
 * Existing accounts are left untouched.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class UserInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final CredentialHasher hasher;

    @Value("${app.init.superadmin.email:}")
    private String superadminEmail;

    @Value("${app.init.superadmin.password:}")
    private String superadminPassword;

    @Override
    @Transactional
    public void run(String... args) {
        if (!StringUtils.hasText(superadminEmail) || !StringUtils.hasText(superadminPassword)) {
            log.debug("No superadmin seed configured");
            return;
        }
        String email = IdentityLookup.normalizeEmail(superadminEmail);
        if (userRepository.existsByEmail(email)) {
            log.info("Superadmin '{}' already present", email);
            return;
        }
        User user = User.builder()
                .email(email)
                .password(ensureEncoded(superadminPassword))
                .role(UserRole.SUPERADMIN)
                .active(true)
                .emailVerified(true)
                .firstName("Super")
                .lastName("Admin")
                .build();
        userRepository.save(user);
        log.info("Superadmin '{}' created", email);
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return hasher.hash(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }
}
