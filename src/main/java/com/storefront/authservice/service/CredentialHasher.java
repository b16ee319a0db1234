package com.storefront.authservice.service;

/**
 * Salted, adaptive password hashing.
 */
public interface CredentialHasher {

    String hash(String plaintext);

    /**
     * Never throws for a mismatch. An absent or malformed hash verifies as {@code false}.
     */
    boolean verify(String plaintext, String hash);
}
