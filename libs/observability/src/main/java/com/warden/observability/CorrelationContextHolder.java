package com.warden.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys declared on {@link CorrelationContext}; clearing it
 * removes them. Servlet containers reuse threads, so whoever sets a context must clear it in a
 * {@code finally} block, or use {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current correlation ID, or {@code null} when no context is bound.
     */
    public static String currentCorrelationId() {
        CorrelationContext context = CONTEXT.get();
        return context != null ? context.correlationId() : null;
    }

    /**
     * Attaches an authenticated subject to the current context. No-op when no context is bound.
     */
    public static void bindSubject(String subject, String scheme) {
        CorrelationContext context = CONTEXT.get();
        if (context != null) {
            set(context.withSubject(subject, scheme));
        }
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SUBJECT);
        MDC.remove(CorrelationContext.MDC_SCHEME);
    }

    /**
     * Runs {@code runnable} with {@code context} bound, then restores the previous context
     * (or clears if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_SUBJECT, ctx.subject());
        setMdc(CorrelationContext.MDC_SCHEME, ctx.scheme());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
