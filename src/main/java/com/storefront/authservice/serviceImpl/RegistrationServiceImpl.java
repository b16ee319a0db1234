package com.storefront.authservice.serviceImpl;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.dto.IdentityRecord;
import com.storefront.authservice.dto.RegistrationRequest;
import com.storefront.authservice.dto.RegistrationResponse;
import com.storefront.authservice.dto.UserSummary;
import com.storefront.authservice.entity.User;
import com.storefront.authservice.entity.UserRole;
import com.storefront.authservice.exception.UserExceptions;
import com.storefront.authservice.repository.UserRepository;
import com.storefront.authservice.service.CredentialHasher;
import com.storefront.authservice.service.IdentityLookup;
import com.storefront.authservice.service.RegistrationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
public class RegistrationServiceImpl implements RegistrationService {

    private final UserRepository userRepository;
    private final CredentialHasher hasher;
    private final boolean verificationRequired;

    public RegistrationServiceImpl(UserRepository userRepository, CredentialHasher hasher, SecurityProperties props) {
        this.userRepository = userRepository;
        this.hasher = hasher;
        this.verificationRequired = props.getAuthentication().isRequireEmailVerification();
    }

    /** New accounts always start as {@link UserRole#USER}; roles are granted by an admin. */
    @Override
    @Transactional
    public RegistrationResponse registerUser(RegistrationRequest request) {
        final String email = IdentityLookup.normalizeEmail(request.getEmail());
        if (email == null || email.isEmpty()) {
            throw new UserExceptions.InvalidUserInput("Email must be provided.");
        }
        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.UserAlreadyExists("An account with this email already exists.");
        }

        User user = User.builder()
                .email(email)
                .password(hasher.hash(request.getPassword()))
                .role(UserRole.USER)
                .active(true)
                .emailVerified(false)
                .firstName(trimToNull(request.getFirstName()))
                .lastName(trimToNull(request.getLastName()))
                .build();
        User saved = userRepository.save(user);
        log.info("Registered identity {}", saved.getId());

        return RegistrationResponse.builder()
                .success(true)
                .message(verificationRequired
                        ? "Registration successful. Verify your email before logging in."
                        : "Registration successful.")
                .user(UserSummary.of(IdentityRecord.from(saved)))
                .verificationRequired(verificationRequired)
                .build();
    }

    private String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
