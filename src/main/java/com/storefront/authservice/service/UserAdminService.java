package com.storefront.authservice.service;

import com.storefront.authservice.SecurityConfig.AuthenticatedIdentity;
import com.storefront.authservice.dto.UserSummary;
import com.storefront.authservice.entity.UserRole;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

/**
 * Identity administration. Changes apply to the stored record at once; a role change reaches the
 * affected identity's requests only after it logs in again.
 */
public interface UserAdminService {

    Page<UserSummary> listUsers(Pageable pageable);

    UserSummary getUser(UUID id);

    UserSummary changeRole(UUID id, UserRole role, AuthenticatedIdentity actor);

    UserSummary setActive(UUID id, boolean active, AuthenticatedIdentity actor);

    /** Clears the account lockout counter and lock. */
    UserSummary unlock(UUID id, AuthenticatedIdentity actor);
}
