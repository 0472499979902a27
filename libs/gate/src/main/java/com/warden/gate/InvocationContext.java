package com.warden.gate;

import com.warden.security.Identity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * What an executor learns about the call it is serving.
 *
 * @param identity      the authenticated caller
 * @param deadline      caller-supplied deadline, {@code null} when unbounded
 * @param correlationId request correlation id
 */
public record InvocationContext(Identity identity, Instant deadline, String correlationId) {

    public InvocationContext {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
    }

    /** Time left before the deadline, never negative; {@code null} when there is no deadline. */
    public Duration remaining(Clock clock) {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
