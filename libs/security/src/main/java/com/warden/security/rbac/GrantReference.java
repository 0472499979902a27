package com.warden.security.rbac;

/**
 * A held permission string, classified once.
 *
 * @param kind  what the string denotes
 * @param value the permission (for the permission kinds) or the role name (for {@link Kind#ROLE})
 */
public record GrantReference(Kind kind, String value) {

    public static final String SUPERUSER = "*";
    public static final String ROLE_PREFIX = "role:";
    public static final String WILDCARD_SUFFIX = ":*";

    public enum Kind {
        /** Exact {@code domain:resource:action} permission. */
        PERMISSION,
        /** Prefix wildcard such as {@code k8s:*} or {@code k8s:pods:*}. */
        WILDCARD,
        /** The reserved {@code *}. */
        SUPERUSER,
        /** Reference to a named role. */
        ROLE
    }

    public GrantReference {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("value must not be empty");
        }
    }

    /**
     * Classifies a held string.
     * <ul>
     *   <li>{@code *} is the superuser grant</li>
     *   <li>{@code role:<name>} references a role; {@code role:*} is not a wildcard, it names a
     *       role called {@code *}, which no loaded policy contains, so it grants nothing</li>
     *   <li>a string without a colon references a role, unless {@code requireRolePrefix} is set,
     *       in which case it is a literal permission</li>
     *   <li>a string ending in {@code :*} is a wildcard</li>
     *   <li>anything else is an exact permission</li>
     * </ul>
     */
    public static GrantReference classify(String held, boolean requireRolePrefix) {
        if (held == null || held.isEmpty()) {
            throw new IllegalArgumentException("held permission must not be empty");
        }
        if (SUPERUSER.equals(held)) {
            return new GrantReference(Kind.SUPERUSER, held);
        }
        if (held.startsWith(ROLE_PREFIX) && held.length() > ROLE_PREFIX.length()) {
            return new GrantReference(Kind.ROLE, held.substring(ROLE_PREFIX.length()));
        }
        if (!held.contains(":")) {
            return new GrantReference(requireRolePrefix ? Kind.PERMISSION : Kind.ROLE, held);
        }
        if (held.endsWith(WILDCARD_SUFFIX)) {
            return new GrantReference(Kind.WILDCARD, held);
        }
        return new GrantReference(Kind.PERMISSION, held);
    }

    /** Whether this grant covers {@code required}. Role references never match directly. */
    public boolean covers(String required) {
        return switch (kind) {
            case PERMISSION -> value.equals(required);
            case WILDCARD -> required.startsWith(value.substring(0, value.length() - 1));
            case SUPERUSER -> true;
            case ROLE -> false;
        };
    }
}
