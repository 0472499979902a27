package com.warden.gate;

/**
 * What a tool call acts on.
 */
public record ToolTarget(String action, String resource, String namespace) {
}
