package com.warden.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags spans with the current
 * {@link CorrelationContext}.
 * <p>
 * Does not configure the SDK; the hosting service supplies the tracer.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_SUBJECT = "enduser.id";
    public static final String ATTR_SCHEME = "auth.scheme";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new INTERNAL span. The span is marked as an error and the
     * exception recorded when {@code work} throws; the exception is rethrown unchanged.
     * A normal return leaves the status UNSET so {@link #markCurrentFailed(String)} still sticks.
     *
     * @param spanName   span name
     * @param attributes extra string attributes
     * @param work       the work to run
     * @return whatever {@code work} returns
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.subject() != null) {
                span.setAttribute(ATTR_SUBJECT, ctx.subject());
            }
            if (ctx.scheme() != null) {
                span.setAttribute(ATTR_SCHEME, ctx.scheme());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            return work.get();
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? "" : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Marks the current span (if any) as failed without ending it.
     */
    public static void markCurrentFailed(String description) {
        Span.current().setStatus(StatusCode.ERROR, description == null ? "" : description);
    }

    public Tracer tracer() {
        return tracer;
    }
}
