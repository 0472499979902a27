package com.warden.audit;

import java.time.Duration;
import java.util.Map;

/**
 * Destination for audit events.
 * <p>
 * {@link #record(AuditEvent)} is fire-and-forget: implementations must not throw and must not
 * block the calling authentication or authorization path. The convenience methods build the
 * canonical events through {@link AuditEvents} and funnel into {@code record}.
 */
public interface AuditSink {

    /**
     * Records one event, assigning its timestamp and id if the caller left them unset.
     */
    void record(AuditEvent event);

    default void authentication(String user, String scheme, boolean success, String errorMessage) {
        record(AuditEvents.authentication(user, scheme, success, errorMessage));
    }

    default void authorization(String user, String action, String resource, String namespace,
                               String permission, boolean granted, String reason) {
        record(AuditEvents.authorization(user, action, resource, namespace, permission, granted, reason));
    }

    default void operation(String user, String action, String resource, String namespace,
                           Duration elapsed, String errorMessage, Map<String, Object> metadata) {
        record(AuditEvents.operation(user, action, resource, namespace, elapsed, errorMessage, metadata));
    }
}
