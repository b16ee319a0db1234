package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.SecurityConfig.AuthenticatedIdentity;
import com.storefront.authservice.config.CacheConfig;
import com.storefront.authservice.dto.IdentityRecord;
import com.storefront.authservice.dto.UserSummary;
import com.storefront.authservice.entity.User;
import com.storefront.authservice.entity.UserRole;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.AuthReason;
import com.storefront.authservice.exception.UserExceptions;
import com.storefront.authservice.repository.UserRepository;
import com.storefront.authservice.service.UserAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserAdminServiceImpl implements UserAdminService {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Page<UserSummary> listUsers(Pageable pageable) {
        return userRepository.findAllNotDeleted(pageable)
                .map(u -> UserSummary.of(IdentityRecord.from(u)));
    }

    @Override
    @Transactional(readOnly = true)
    public UserSummary getUser(UUID id) {
        return UserSummary.of(IdentityRecord.from(load(id)));
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.IDENTITY_BY_ID, key = "#id")
    public UserSummary changeRole(UUID id, UserRole role, AuthenticatedIdentity actor) {
        if (id.equals(actor.id())) {
            throw new UserExceptions.UserUpdateConflict("You cannot change your own role.");
        }
        User user = load(id);
        UserRole previous = user.getRole();
        user.setRole(role);
        log.info("Role of {} changed {} -> {} by {}", id, previous, role, actor.id());
        return UserSummary.of(IdentityRecord.from(user));
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.IDENTITY_BY_ID, key = "#id")
    public UserSummary setActive(UUID id, boolean active, AuthenticatedIdentity actor) {
        if (id.equals(actor.id())) {
            throw new UserExceptions.UserUpdateConflict("You cannot change your own account status.");
        }
        User user = load(id);
        if (user.getRole() == UserRole.SUPERADMIN && actor.role() != UserRole.SUPERADMIN) {
            log.warn("Admin {} tried to change status of superadmin {}", actor.id(), id);
            throw new AuthExceptions.Forbidden(AuthReason.INSUFFICIENT_ROLE,
                    "You do not have permission to modify this account.");
        }
        user.setActive(active);
        log.info("Account {} {} by {}", id, active ? "activated" : "deactivated", actor.id());
        return UserSummary.of(IdentityRecord.from(user));
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.IDENTITY_BY_ID, key = "#id")
    public UserSummary unlock(UUID id, AuthenticatedIdentity actor) {
        User user = load(id);
        user.setFailedLoginAttempts(0);
        user.setLockUntil(null);
        log.info("Account {} unlocked by {}", id, actor.id());
        return UserSummary.of(IdentityRecord.from(user));
    }

    private User load(UUID id) {
        return userRepository.findLiveById(id)
                .orElseThrow(() -> new UserExceptions.UserNotFound("No user with id " + id));
    }
}
