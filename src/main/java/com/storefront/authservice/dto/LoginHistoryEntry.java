package com.storefront.authservice.dto;

import com.storefront.authservice.entity.LoginRecord;

import java.time.Instant;

public record LoginHistoryEntry(Instant loginAt, String ipAddress, String userAgent) {

    public static LoginHistoryEntry from(LoginRecord record) {
        return new LoginHistoryEntry(record.getLoginAt(), record.getIpAddress(), record.getUserAgent());
    }
}
