package com.storefront.authservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.storefront.authservice.entity.User;

import java.time.Instant;

/**
 * Credential-path view of an identity: the only read model that includes the hash.
 * Used by login alone and never returned from a handler.
 */
public record CredentialRecord(IdentityRecord identity,
                               @JsonIgnore String passwordHash,
                               Instant lockUntil) {

    public static CredentialRecord from(User user) {
        return new CredentialRecord(IdentityRecord.from(user), user.getPassword(), user.getLockUntil());
    }

    public boolean isLockedAt(Instant now) {
        return lockUntil != null && lockUntil.isAfter(now);
    }

    @Override
    public String toString() {
        return "CredentialRecord[" + identity.email() + "]";
    }
}
