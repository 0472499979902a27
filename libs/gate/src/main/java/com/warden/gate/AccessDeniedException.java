package com.warden.gate;

/**
 * Thrown when an authenticated caller lacks the permission for a request.
 * <p>
 * The message names the attempted permission and namespace. It is safe to show to the caller,
 * whose identity is already established at this point.
 */
public class AccessDeniedException extends RuntimeException {

    private final String subject;
    private final String permission;
    private final String namespace;

    public AccessDeniedException(String subject, String permission, String namespace) {
        super("access denied: %s in namespace %s".formatted(permission, namespace));
        this.subject = subject;
        this.permission = permission;
        this.namespace = namespace;
    }

    public String subject() {
        return subject;
    }

    public String permission() {
        return permission;
    }

    public String namespace() {
        return namespace;
    }
}
