package com.warden.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps secret material out of logs and audit lines.
 * <p>
 * Two jobs: {@link #redact(Map)} replaces the values of map entries whose key looks like a
 * secret (password, token, secret, authorization, apikey, credential, key material), and
 * {@link #mask(String)} shortens a raw credential to a recognisable prefix. Key matching is
 * case-insensitive.
 */
public final class CredentialRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final String MASK = "****";
    private static final int VISIBLE_PREFIX = 8;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "signing"
    );

    private final Pattern sensitiveKeys;

    public CredentialRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns key fragments treated as sensitive (case-insensitive)
     */
    public CredentialRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be empty");
        }
        String regex = String.join("|", patterns.stream().map(Pattern::quote).toList());
        this.sensitiveKeys = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Nested maps are redacted recursively. Null or empty input yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> {
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redact(stringKeyed(nested)));
            } else {
                result.put(key, value);
            }
        });
        return result;
    }

    /**
     * Checks whether a field name contains any sensitive fragment.
     */
    public boolean isSensitive(String fieldName) {
        return fieldName != null && sensitiveKeys.matcher(fieldName).find();
    }

    /**
     * Masks a raw credential, showing only its first 8 characters.
     * Credentials of 8 characters or fewer are fully masked.
     */
    public static String mask(String credential) {
        if (credential == null || credential.length() <= VISIBLE_PREFIX) {
            return MASK;
        }
        return credential.substring(0, VISIBLE_PREFIX) + MASK;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> nested) {
        Map<String, Object> copy = new LinkedHashMap<>(nested.size());
        nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
