package com.warden.audit;

import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.CredentialRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Writes audit events as JSON lines to the dedicated {@value #AUDIT_LOGGER} SLF4J logger.
 * <p>
 * Each line is tagged with the {@link #AUDIT_MARKER} marker and the {@code "audit":true} field.
 * The logging backend decides where the lines end up (file, collector); logback appenders are
 * safe for concurrent appends. Secret-looking metadata is redacted and the current correlation
 * id, when bound, is added to the metadata.
 * <p>
 * Write failures are reported on this class's own logger and the event is dropped.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String AUDIT_LOGGER = "warden.audit";
    public static final Marker AUDIT_MARKER = MarkerFactory.getMarker("AUDIT");

    private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);

    private final Logger auditLog;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final CredentialRedactor redactor;

    public LoggingAuditSink() {
        this(LoggerFactory.getLogger(AUDIT_LOGGER), Clock.systemUTC(),
                () -> UUID.randomUUID().toString(), new CredentialRedactor());
    }

    public LoggingAuditSink(Logger auditLog, Clock clock, Supplier<String> idGenerator,
                            CredentialRedactor redactor) {
        this.auditLog = auditLog;
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.redactor = redactor;
    }

    @Override
    public void record(AuditEvent event) {
        if (event == null) {
            log.warn("Ignoring null audit event");
            return;
        }
        try {
            AuditEvent completed = prepare(event);
            ValidationResult validation = AuditEventValidator.validate(completed);
            if (!validation.valid()) {
                log.warn("Audit event {} is incomplete: {}", completed.eventId(), validation.errors());
            }
            auditLog.info(AUDIT_MARKER, AuditEventSerializer.serialize(completed));
        } catch (RuntimeException e) {
            log.warn("Audit write failed, event dropped (type={}, user={})",
                    event.eventType().value(), event.user(), e);
        }
    }

    private AuditEvent prepare(AuditEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>(redactor.redact(event.metadata()));
        String correlationId = CorrelationContextHolder.currentCorrelationId();
        if (correlationId != null) {
            metadata.putIfAbsent("correlation_id", correlationId);
        }
        return event.complete(clock, idGenerator).withMetadata(metadata);
    }
}
