package com.warden.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome recorded on an audit event.
 * <p>
 * Authentication and operation events use SUCCESS/FAILURE; authorization events use
 * GRANTED/DENIED.
 */
public enum AuditResult {

    SUCCESS("success"),
    FAILURE("failure"),
    GRANTED("granted"),
    DENIED("denied");

    private final String value;

    AuditResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static AuditResult ofAuthentication(boolean success) {
        return success ? SUCCESS : FAILURE;
    }

    public static AuditResult ofAuthorization(boolean granted) {
        return granted ? GRANTED : DENIED;
    }

    /** True for SUCCESS and GRANTED. */
    public boolean isPositive() {
        return this == SUCCESS || this == GRANTED;
    }
}
