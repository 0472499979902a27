package com.warden.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization for {@link AuditEvent}.
 * <p>
 * Every line starts with {@code "audit":true} so downstream processors can filter audit
 * records from ordinary application logs. Instants are written as ISO 8601 strings.
 */
public final class AuditEventSerializer {

    /** Marker field present on every serialized audit line. */
    public static final String AUDIT_FIELD = "audit";

    private static final ObjectMapper MAPPER = createMapper();

    private AuditEventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes an event to a single-line JSON string.
     *
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditEvent event) {
        try {
            ObjectNode line = MAPPER.createObjectNode();
            line.put(AUDIT_FIELD, true);
            line.setAll((ObjectNode) MAPPER.valueToTree(event));
            return MAPPER.writeValueAsString(line);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AuditSerializationException("Failed to serialize audit event: " + event.eventId(), e);
        }
    }

    /**
     * Parses a serialized audit line back into an event. The {@code audit} marker is ignored.
     *
     * @throws AuditSerializationException if the JSON is malformed
     */
    public static AuditEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, AuditEvent.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit event", e);
        }
    }

    /**
     * Thrown when an audit event cannot be converted to or from JSON.
     */
    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
