package com.storefront.authservice.service;

import com.storefront.authservice.dto.LoginHistoryEntry;
import com.storefront.authservice.utils.RequestMetadata;

import java.util.List;
import java.util.UUID;

public interface IdentityActivityService {

    /** Best-effort, asynchronous last-active update. */
    void touch(UUID identityId);

    /** Stamps last-login and appends to the bounded login history. */
    void recordLogin(UUID identityId, RequestMetadata.ClientInfo client);

    List<LoginHistoryEntry> recentLogins(UUID identityId);
}
