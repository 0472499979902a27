package com.warden.gateway.execution;

import com.warden.gate.InvocationContext;
import com.warden.gate.ToolExecutor;
import com.warden.gate.ToolResult;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default executor: acknowledges an authorized call without touching a cluster.
 *
 * <p>Registered only when no other {@link ToolExecutor} bean exists. A deployment that talks to a
 * real cluster provides its own executor bean.
 */
public class AcknowledgingToolExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgingToolExecutor.class);

    private final Clock clock;

    public AcknowledgingToolExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(InvocationContext context, String toolName, Map<String, Object> arguments) {
        Duration remaining = context.remaining(clock);
        if (remaining != null && remaining.isZero()) {
            return ToolResult.failed("deadline exceeded before " + toolName + " could run");
        }

        log.info("Tool acknowledged: tool={}, subject={}", toolName, context.identity().subject());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool", toolName);
        data.put("subject", context.identity().subject());
        data.put("arguments", arguments);
        data.put("correlationId", context.correlationId());
        return ToolResult.ok("Tool " + toolName + " accepted", data);
    }
}
