package com.warden.gate;

import java.time.Instant;
import java.util.Map;

/**
 * One inbound tool invocation as seen by the gate.
 *
 * @param authorizationHeader raw {@code Authorization} header value, may be null
 * @param toolName            tool to run
 * @param arguments           tool arguments
 * @param deadline            optional deadline handed to the executor
 * @param correlationId       optional; the bound correlation id or a fresh one is used when absent
 */
public record GateRequest(
        String authorizationHeader,
        String toolName,
        Map<String, Object> arguments,
        Instant deadline,
        String correlationId
) {

    public GateRequest {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName must not be blank");
        }
        arguments = arguments == null ? Map.of() : arguments;
    }

    public static GateRequest of(String authorizationHeader, String toolName, Map<String, Object> arguments) {
        return new GateRequest(authorizationHeader, toolName, arguments, null, null);
    }
}
