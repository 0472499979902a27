package com.warden.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The three decision points that produce audit events.
 */
public enum AuditEventType {

    AUTHENTICATION("authentication"),
    AUTHORIZATION("authorization"),
    OPERATION("operation");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    /** The canonical string written to the audit line (e.g. "authorization"). */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Looks up an event type by its canonical string value.
     *
     * @param value the string to match
     * @return the matching type, or empty if not found
     */
    public static Optional<AuditEventType> fromString(String value) {
        for (AuditEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
