package com.storefront.authservice.service;

import com.storefront.authservice.dto.CredentialRecord;
import com.storefront.authservice.dto.IdentityRecord;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to identities. Implementations let {@link org.springframework.dao.DataAccessException}
 * propagate: an unreachable backend is not the same as "not found".
 */
public interface IdentityLookup {

    Optional<IdentityRecord> findById(UUID id);

    /** Case-insensitive; the email is normalised before lookup. */
    Optional<IdentityRecord> findByEmail(String email);

    /** Login path only. */
    Optional<CredentialRecord> findCredentialsByEmail(String email);

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
