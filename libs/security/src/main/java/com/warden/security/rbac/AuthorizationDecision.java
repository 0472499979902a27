package com.warden.security.rbac;

/**
 * Outcome of an authorization check.
 *
 * @param granted    whether access is allowed
 * @param permission the permission that was required
 * @param namespace  the namespace of the request
 * @param grantedBy  the held grant or role that allowed access, {@code null} when denied
 * @param reason     denial reason, {@code null} when granted
 */
public record AuthorizationDecision(
        boolean granted,
        String permission,
        String namespace,
        String grantedBy,
        String reason
) {

    public static AuthorizationDecision grant(String permission, String namespace, String grantedBy) {
        return new AuthorizationDecision(true, permission, namespace, grantedBy, null);
    }

    public static AuthorizationDecision deny(String permission, String namespace) {
        return new AuthorizationDecision(false, permission, namespace, null,
                "permission denied: %s in namespace %s".formatted(permission, namespace));
    }
}
