package com.storefront.authservice.exception;

/**
 * Fatal misconfiguration detected while the context starts (e.g. missing or weak signing secret).
 * Never mapped to a response: the application must not come up.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
