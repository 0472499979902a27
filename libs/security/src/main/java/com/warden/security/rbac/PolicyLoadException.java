package com.warden.security.rbac;

/**
 * Thrown when a permission policy document cannot be loaded. Fatal at startup.
 */
public class PolicyLoadException extends RuntimeException {

    private final String source;

    public PolicyLoadException(String source, String message) {
        super("Failed to load permission policy from %s: %s".formatted(source, message));
        this.source = source;
    }

    public PolicyLoadException(String source, String message, Throwable cause) {
        super("Failed to load permission policy from %s: %s".formatted(source, message), cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
