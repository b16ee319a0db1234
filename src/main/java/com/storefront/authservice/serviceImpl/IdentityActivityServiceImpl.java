package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.config.AsyncConfig;
import com.storefront.authservice.dto.LoginHistoryEntry;
import com.storefront.authservice.entity.LoginRecord;
import com.storefront.authservice.entity.User;
import com.storefront.authservice.repository.LoginRecordRepository;
import com.storefront.authservice.repository.UserRepository;
import com.storefront.authservice.service.IdentityActivityService;
import com.storefront.authservice.utils.RequestMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import com.storefront.authservice.config.CacheConfig;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityActivityServiceImpl implements IdentityActivityService {

    static final int HISTORY_LIMIT = 10;

    private final UserRepository userRepository;
    private final LoginRecordRepository loginRecordRepository;
    private final Clock clock;

    @Override
    @Async(AsyncConfig.ACTIVITY_EXECUTOR)
    @Transactional
    public void touch(UUID identityId) {
        try {
            userRepository.touchLastActive(identityId, clock.instant());
        } catch (DataAccessException e) {
            log.debug("Last-active update failed for {}: {}", identityId, e.toString());
        }
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.IDENTITY_BY_ID, key = "#identityId")
    public void recordLogin(UUID identityId, RequestMetadata.ClientInfo client) {
        Instant now = clock.instant();
        User user = userRepository.getReferenceById(identityId);
        user.setLastLoginAt(now);
        user.setLastActiveAt(now);

        loginRecordRepository.save(LoginRecord.builder()
                .user(user)
                .loginAt(now)
                .ipAddress(client != null ? client.ip() : null)
                .userAgent(client != null ? client.userAgent() : null)
                .build());

        long count = loginRecordRepository.countByUserId(identityId);
        if (count > HISTORY_LIMIT) {
            List<LoginRecord> oldest = loginRecordRepository.findOldest(identityId,
                    PageRequest.of(0, (int) (count - HISTORY_LIMIT)));
            loginRecordRepository.deleteAll(oldest);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoginHistoryEntry> recentLogins(UUID identityId) {
        return loginRecordRepository.findRecent(identityId, PageRequest.of(0, HISTORY_LIMIT)).stream()
                .map(LoginHistoryEntry::from)
                .toList();
    }
}
