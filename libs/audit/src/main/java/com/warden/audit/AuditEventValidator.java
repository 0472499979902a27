package com.warden.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a completed {@link AuditEvent} carries the fields log shippers rely on.
 */
public final class AuditEventValidator {

    private AuditEventValidator() {
        // utility class
    }

    /**
     * Validates a completed event and returns every problem found.
     */
    public static ValidationResult validate(AuditEvent event) {
        List<String> errors = new ArrayList<>();

        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        if (isBlank(event.eventId())) {
            errors.add("event_id must not be null or blank");
        }
        if (isBlank(event.user())) {
            errors.add("user must not be null or blank");
        }
        if (isBlank(event.action())) {
            errors.add("action must not be null or blank");
        }
        if (event.durationMs() < 0) {
            errors.add("duration_ms must be >= 0");
        }
        boolean authorization = event.eventType() == AuditEventType.AUTHORIZATION;
        boolean decisionResult = event.result() == AuditResult.GRANTED || event.result() == AuditResult.DENIED;
        if (authorization != decisionResult) {
            errors.add("result '%s' does not fit event_type '%s'"
                    .formatted(event.result().value(), event.eventType().value()));
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
