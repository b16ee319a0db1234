package com.storefront.authservice.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/** SHA-256, base64url without padding. Raw tokens are never stored or logged. */
public final class TokenDigest {

    private TokenDigest() {}

    public static String sha256Url(String data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(dig);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** First eight digest characters, for log lines. */
    public static String shortId(String token) {
        return sha256Url(token).substring(0, 8);
    }
}
