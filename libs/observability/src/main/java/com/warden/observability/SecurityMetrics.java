package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for the security gate.
 * <p>
 * Every meter carries a {@code service} tag. Meter names:
 * <ul>
 *   <li>{@value #AUTHENTICATION} counter, tags {@code scheme} and {@code result}</li>
 *   <li>{@value #AUTHORIZATION} counter, tag {@code result}</li>
 *   <li>{@value #OPERATION} timer, tags {@code tool} and {@code result}</li>
 * </ul>
 * Subjects are never used as tags (unbounded cardinality). Callers pass only canonical scheme
 * names, never raw header input.
 */
public final class SecurityMetrics {

    public static final String AUTHENTICATION = "warden.authentication";
    public static final String AUTHORIZATION = "warden.authorization";
    public static final String OPERATION = "warden.operation";

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public SecurityMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Counts one authentication attempt. */
    public void authentication(String scheme, boolean success) {
        Counter.builder(AUTHENTICATION)
                .description("Authentication attempts by scheme and outcome")
                .tags(baseTags("scheme", scheme == null ? "none" : scheme,
                        "result", success ? "success" : "failure"))
                .register(registry)
                .increment();
    }

    /** Counts one authorization decision. */
    public void authorization(boolean granted) {
        Counter.builder(AUTHORIZATION)
                .description("Authorization decisions by outcome")
                .tags(baseTags("result", granted ? "granted" : "denied"))
                .register(registry)
                .increment();
    }

    /** Records the duration of one executed operation. */
    public void operation(String tool, boolean success, Duration duration) {
        Timer.builder(OPERATION)
                .description("Duration of gated operations")
                .tags(baseTags("tool", tool, "result", success ? "success" : "failure"))
                .register(registry)
                .record(duration);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Tags baseTags(String... extraTags) {
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }
}
