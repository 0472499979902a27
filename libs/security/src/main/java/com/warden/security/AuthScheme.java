package com.warden.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Credential schemes the gate understands.
 * <p>
 * Each scheme has a canonical name used on identities and in the audit trail, and the token
 * that announces it in the {@code Authorization} header.
 */
public enum AuthScheme {

    KEY("key", "apikey"),
    TOKEN("token", "bearer");

    private final String value;
    private final String headerToken;

    AuthScheme(String value, String headerToken) {
        this.value = value;
        this.headerToken = headerToken;
    }

    /** Canonical scheme name (e.g., "key"). */
    public String value() {
        return value;
    }

    /** Lower-case token expected in the header (e.g., "apikey"). */
    public String headerToken() {
        return headerToken;
    }

    public static Optional<AuthScheme> fromString(String value) {
        for (AuthScheme scheme : values()) {
            if (scheme.value.equals(value)) {
                return Optional.of(scheme);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a scheme by its header token, ignoring case ("Bearer", "BEARER" and "bearer" all
     * resolve to {@link #TOKEN}).
     */
    public static Optional<AuthScheme> fromHeaderToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.toLowerCase(Locale.ROOT);
        for (AuthScheme scheme : values()) {
            if (scheme.headerToken.equals(normalized)) {
                return Optional.of(scheme);
            }
        }
        return Optional.empty();
    }
}
