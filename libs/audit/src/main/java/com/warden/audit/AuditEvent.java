package com.warden.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * One immutable audit record: an authentication attempt, an authorization decision or a
 * completed operation.
 * <p>
 * Serialized as a single JSON line whose field names are fixed for log shippers:
 * {@code timestamp, event_id, event_type, user, action, resource, namespace, result,
 * error_message, metadata, duration_ms}. {@code timestamp} and {@code event_id} may be left
 * null by the producer; the sink fills them via {@link #complete(Clock, Supplier)}.
 *
 * @param timestamp    when the decision was made
 * @param eventId      unique id of this event
 * @param eventType    which decision point produced it
 * @param user         subject of the request ({@code unknown} before authentication)
 * @param action       the attempted action
 * @param resource     the targeted resource (nullable for authentication events)
 * @param namespace    the targeted namespace (nullable)
 * @param result       outcome of the decision
 * @param errorMessage internal failure detail (nullable); never shown to the caller
 * @param metadata     open bag of extra fields
 * @param durationMs   elapsed milliseconds (0 when not measured)
 */
@JsonPropertyOrder({"timestamp", "event_id", "event_type", "user", "action", "resource",
        "namespace", "result", "error_message", "metadata", "duration_ms"})
public record AuditEvent(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("event_type") AuditEventType eventType,
        @JsonProperty("user") String user,
        @JsonProperty("action") String action,
        @JsonProperty("resource") String resource,
        @JsonProperty("namespace") @JsonInclude(JsonInclude.Include.NON_NULL) String namespace,
        @JsonProperty("result") AuditResult result,
        @JsonProperty("error_message") @JsonInclude(JsonInclude.Include.NON_NULL) String errorMessage,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("duration_ms") long durationMs
) {

    public AuditEvent {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result must not be null");
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns this event with {@code timestamp} and {@code eventId} filled in when missing.
     * Returns {@code this} when both are already set.
     */
    public AuditEvent complete(Clock clock, Supplier<String> idGenerator) {
        boolean needsTimestamp = timestamp == null;
        boolean needsId = eventId == null || eventId.isBlank();
        if (!needsTimestamp && !needsId) {
            return this;
        }
        return new AuditEvent(
                needsTimestamp ? clock.instant() : timestamp,
                needsId ? idGenerator.get() : eventId,
                eventType, user, action, resource, namespace, result, errorMessage,
                metadata, durationMs);
    }

    /** Returns a copy with the given metadata map. */
    public AuditEvent withMetadata(Map<String, Object> newMetadata) {
        return new AuditEvent(timestamp, eventId, eventType, user, action, resource, namespace,
                result, errorMessage, newMetadata, durationMs);
    }
}
