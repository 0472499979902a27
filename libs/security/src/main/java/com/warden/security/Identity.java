package com.warden.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The authenticated caller.
 * <p>
 * Built fresh on every successful authentication and never persisted. Attributes are
 * informational (key id, last use, token timestamps); authorization only looks at
 * {@link #permissions()}.
 *
 * @param scheme      canonical scheme that authenticated the caller ("key" or "token")
 * @param subject     human-readable label: key owner name or token username
 * @param permissions held permission strings and role references, ordered, without duplicates
 * @param attributes  scheme-specific details
 */
public record Identity(
        String scheme,
        String subject,
        List<String> permissions,
        Map<String, Object> attributes
) {

    public static final String ATTR_KEY_ID = "key_id";
    public static final String ATTR_LAST_USED = "last_used";
    public static final String ATTR_USER_ID = "user_id";
    public static final String ATTR_ISSUED_AT = "issued_at";
    public static final String ATTR_EXPIRES_AT = "expires_at";

    public Identity {
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("scheme must not be blank");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        permissions = permissions == null ? List.of() : List.copyOf(new LinkedHashSet<>(permissions));
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean hasPermissions() {
        return !permissions.isEmpty();
    }
}
