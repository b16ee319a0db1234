package com.storefront.authservice.SecurityConfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic eviction of stale lockout records and expired revocations. Each store evicts
 * entry by entry, so request threads are never held up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthStateSweeper {

    private final LoginAttemptGuard guard;
    private final TokenBlacklistConfig blacklist;

    @Scheduled(fixedDelayString = "${app.security.sweep-interval:PT1H}",
               initialDelayString = "${app.security.sweep-interval:PT1H}")
    public void sweep() {
        try {
            int staleAttempts = guard.sweep();
            int expiredRevocations = blacklist.sweep();
            if (staleAttempts > 0 || expiredRevocations > 0) {
                log.info("Sweep removed {} stale attempt records and {} expired revocations",
                        staleAttempts, expiredRevocations);
            }
        } catch (DataAccessException e) {
            log.warn("Auth state sweep failed: {}", e.toString());
        }
    }
}
