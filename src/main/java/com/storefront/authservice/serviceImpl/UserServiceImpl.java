package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.config.CacheConfig;
import com.storefront.authservice.dto.CredentialRecord;
import com.storefront.authservice.dto.IdentityRecord;
import com.storefront.authservice.repository.UserRepository;
import com.storefront.authservice.service.IdentityLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements IdentityLookup {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.IDENTITY_BY_ID, unless = "#result == null")
    public Optional<IdentityRecord> findById(UUID id) {
        if (id == null) return Optional.empty();
        log.debug("Loading identity {}", id);
        return userRepository.findLiveById(id).map(IdentityRecord::from);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IdentityRecord> findByEmail(String email) {
        String normalized = IdentityLookup.normalizeEmail(email);
        if (normalized == null || normalized.isEmpty()) return Optional.empty();
        return userRepository.findByEmail(normalized).map(IdentityRecord::from);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CredentialRecord> findCredentialsByEmail(String email) {
        String normalized = IdentityLookup.normalizeEmail(email);
        if (normalized == null || normalized.isEmpty()) return Optional.empty();
        return userRepository.findByEmail(normalized).map(CredentialRecord::from);
    }
}
