package com.warden.security.credential;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of a long-lived opaque credential. Never carries the secret itself.
 *
 * @param id          stable identifier used for revocation
 * @param displayName owner label, becomes the identity subject
 * @param permissions permission strings or role references
 * @param createdAt   registration time
 * @param expiresAt   optional expiry; {@code null} means the credential does not expire
 * @param lastUsedAt  time of the last successful validation, {@code null} if never used
 */
public record CredentialRecord(
        String id,
        String displayName,
        List<String> permissions,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsedAt
) {

    public CredentialRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must not be blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static CredentialRecord of(String id, String displayName, List<String> permissions, Instant createdAt) {
        return new CredentialRecord(id, displayName, permissions, createdAt, null, null);
    }

    /** A record whose expiry is at or before {@code now} is expired. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public CredentialRecord withLastUsedAt(Instant instant) {
        return new CredentialRecord(id, displayName, permissions, createdAt, expiresAt, instant);
    }

    public CredentialRecord withExpiresAt(Instant instant) {
        return new CredentialRecord(id, displayName, permissions, createdAt, instant, lastUsedAt);
    }
}
