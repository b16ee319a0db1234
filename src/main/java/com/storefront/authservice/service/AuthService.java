package com.storefront.authservice.service;

import com.storefront.authservice.SecurityConfig.IdentityAuthentication;
import com.storefront.authservice.dto.LoginRequest;
import com.storefront.authservice.dto.LoginResponse;
import com.storefront.authservice.dto.SessionResponse;
import com.storefront.authservice.utils.RequestMetadata;

public interface AuthService {

    LoginResponse login(LoginRequest request, RequestMetadata.ClientInfo client);

    /** Revokes {@code token} when one was presented. Repeating it for the same token is harmless. */
    void logout(String token);

    SessionResponse currentSession(IdentityAuthentication authentication, boolean includeHistory);
}
