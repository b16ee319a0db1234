package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.entity.User;
import com.storefront.authservice.exception.AuthExceptions;
import com.storefront.authservice.exception.AuthReason;
import com.storefront.authservice.repository.UserRepository;
import com.storefront.authservice.service.AccountLockoutService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
public class AccountLockoutServiceImpl implements AccountLockoutService {

    private final UserRepository userRepository;
    private final SecurityProperties.AccountLockout config;
    private final Clock clock;

    public AccountLockoutServiceImpl(UserRepository userRepository, SecurityProperties props, Clock clock) {
        this.userRepository = userRepository;
        this.config = props.getAccountLockout();
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public void ensureNotLocked(UUID identityId) {
        if (!config.isEnabled()) return;
        Instant now = clock.instant();
        userRepository.findById(identityId)
                .filter(u -> u.isLockedAt(now))
                .ifPresent(u -> {
                    throw new AuthExceptions.RateLimited(AuthReason.ACCOUNT_LOCKED,
                            Duration.between(now, u.getLockUntil()), u.getLockUntil());
                });
    }

    @Override
    @Transactional
    public void recordFailure(UUID identityId) {
        if (!config.isEnabled()) return;
        Instant now = clock.instant();
        userRepository.findForUpdateById(identityId).ifPresent(user -> {
            if (user.getLockUntil() != null && !user.isLockedAt(now)) {
                // Previous lock ran out: start counting afresh.
                user.setLockUntil(null);
                user.setFailedLoginAttempts(0);
            }
            int attempts = user.getFailedLoginAttempts() + 1;
            user.setFailedLoginAttempts(attempts);
            if (attempts >= config.getThreshold() && !user.isLockedAt(now)) {
                user.setLockUntil(now.plus(config.getDuration()));
                log.warn("Account {} locked until {} after {} failed logins", user.getId(), user.getLockUntil(), attempts);
            }
        });
    }

    @Override
    @Transactional
    public void reset(UUID identityId) {
        userRepository.findForUpdateById(identityId).ifPresent(this::clear);
    }

    private void clear(User user) {
        if (user.getFailedLoginAttempts() != 0 || user.getLockUntil() != null) {
            user.setFailedLoginAttempts(0);
            user.setLockUntil(null);
        }
    }
}
