package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.service.CredentialHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class BCryptCredentialHasher implements CredentialHasher {

    private final PasswordEncoder passwordEncoder;

    @Override
    public String hash(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        return passwordEncoder.encode(plaintext);
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be read: {}", e.getMessage());
            return false;
        }
    }
}
