package com.storefront.authservice.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for every per-request auth failure. The concrete subclasses live in {@link AuthExceptions};
 * each fixes its {@link AuthErrorKind}, and the {@link AuthReason} narrows it for the client.
 */
@Getter
public abstract class AuthException extends ApiException {

    private final AuthErrorKind kind;
    private final AuthReason reason;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    protected AuthException(AuthErrorKind kind, AuthReason reason, String detail) {
        super(kind.status(), kind.type(), kind.title(), detail);
        this.kind = kind;
        this.reason = reason;
    }

    protected AuthException(AuthErrorKind kind, AuthReason reason, String detail, Throwable cause) {
        this(kind, reason, detail);
        initCause(cause);
    }

    @Override
    public String code() {
        return reason.name();
    }

    @Override
    public Map<String, Object> properties() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("kind", kind.name());
        props.put("requiresAuth", kind.requiresLogin());
        props.putAll(extra);
        return props;
    }

    /** Seconds the client should wait before retrying, when the failure is time-bound. */
    public Duration retryAfter() {
        return null;
    }

    protected void put(String key, Object value) {
        if (value != null) {
            extra.put(key, value);
        }
    }
}
