package com.warden.observability;

/**
 * Immutable correlation context that flows with a single gated request.
 * <p>
 * Every inbound call establishes a {@code CorrelationContext} before the security gate runs.
 * Once the caller has been authenticated the gate replaces it with a copy that also carries the
 * subject and scheme, so every log line written after that point names who made the call.
 * Values are mirrored into SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId unique ID for the request flow (echoed back to the client)
 * @param requestId     unique ID for this specific call (nullable)
 * @param subject       authenticated subject (nullable until authentication succeeds)
 * @param scheme        authentication scheme that produced the subject (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String subject,
        String scheme
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the authenticated subject. */
    public static final String MDC_SUBJECT = "subject";

    /** MDC key for the authentication scheme. */
    public static final String MDC_SCHEME = "authScheme";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for an anonymous (not yet authenticated) request.
     */
    public static CorrelationContext anonymous(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy carrying the authenticated subject and scheme.
     */
    public CorrelationContext withSubject(String subject, String scheme) {
        return new CorrelationContext(correlationId, requestId, subject, scheme);
    }
}
