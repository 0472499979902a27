package com.warden.gate;

import java.util.Map;

/**
 * Executor outcome.
 *
 * @param success whether the tool ran successfully
 * @param message human-readable summary
 * @param data    structured payload, passed through untouched
 * @param error   failure description when {@code success} is false
 */
public record ToolResult(boolean success, String message, Map<String, Object> data, String error) {

    public ToolResult {
        data = data == null ? Map.of() : data;
    }

    public static ToolResult ok(String message, Map<String, Object> data) {
        return new ToolResult(true, message, data, null);
    }

    public static ToolResult failed(String error) {
        return new ToolResult(false, null, Map.of(), error);
    }
}
