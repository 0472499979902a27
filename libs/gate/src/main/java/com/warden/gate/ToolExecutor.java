package com.warden.gate;

import java.util.Map;

/**
 * Runs a tool after the gate has let the call through.
 */
@FunctionalInterface
public interface ToolExecutor {

    ToolResult execute(InvocationContext context, String toolName, Map<String, Object> arguments);
}
