package com.warden.audit;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory methods for the three canonical audit events.
 * <p>
 * The returned events leave {@code timestamp} and {@code eventId} unset; the sink assigns them
 * when recording, so every event shares one schema regardless of which entry point built it.
 */
public final class AuditEvents {

    /** Subject recorded when the caller could not be identified. */
    public static final String UNKNOWN_USER = "unknown";

    public static final String ACTION_AUTHENTICATE = "authenticate";

    private AuditEvents() {
        // utility class
    }

    /**
     * An authentication attempt.
     *
     * @param user         authenticated subject, or null/blank for {@value #UNKNOWN_USER}
     * @param scheme       authentication scheme attempted (nullable when it could not be parsed)
     * @param success      whether authentication succeeded
     * @param errorMessage internal failure detail (nullable)
     */
    public static AuditEvent authentication(String user, String scheme, boolean success, String errorMessage) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("auth_type", scheme == null ? "none" : scheme);
        return new AuditEvent(
                null, null,
                AuditEventType.AUTHENTICATION,
                userOrUnknown(user),
                ACTION_AUTHENTICATE,
                null, null,
                AuditResult.ofAuthentication(success),
                success ? null : errorMessage,
                metadata,
                0L);
    }

    /**
     * An authorization decision.
     *
     * @param permission the permission that was checked
     * @param reason     denial reason (ignored when granted)
     */
    public static AuditEvent authorization(String user, String action, String resource, String namespace,
                                           String permission, boolean granted, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("permission_check", true);
        metadata.put("permission", permission);
        return new AuditEvent(
                null, null,
                AuditEventType.AUTHORIZATION,
                userOrUnknown(user),
                action, resource, namespace,
                AuditResult.ofAuthorization(granted),
                granted ? null : reason,
                metadata,
                0L);
    }

    /**
     * A completed (or failed) operation that passed the gate.
     *
     * @param elapsed      time since the request started
     * @param errorMessage executor failure detail, or null on success
     * @param extra        additional metadata (nullable)
     */
    public static AuditEvent operation(String user, String action, String resource, String namespace,
                                       Duration elapsed, String errorMessage, Map<String, Object> extra) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (extra != null) {
            metadata.putAll(extra);
        }
        return new AuditEvent(
                null, null,
                AuditEventType.OPERATION,
                userOrUnknown(user),
                action, resource, namespace,
                errorMessage == null ? AuditResult.SUCCESS : AuditResult.FAILURE,
                errorMessage,
                metadata,
                elapsed == null ? 0L : elapsed.toMillis());
    }

    private static String userOrUnknown(String user) {
        return user == null || user.isBlank() ? UNKNOWN_USER : user;
    }
}
