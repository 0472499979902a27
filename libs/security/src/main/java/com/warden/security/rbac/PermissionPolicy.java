package com.warden.security.rbac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of roles, looked up by exact name.
 */
public final class PermissionPolicy {

    private static final PermissionPolicy EMPTY = new PermissionPolicy(List.of());

    private final Map<String, Role> rolesByName;

    public PermissionPolicy(List<Role> roles) {
        Map<String, Role> byName = new LinkedHashMap<>();
        for (Role role : roles == null ? List.<Role>of() : roles) {
            if (byName.putIfAbsent(role.name(), role) != null) {
                throw new IllegalArgumentException("duplicate role: " + role.name());
            }
        }
        this.rolesByName = Collections.unmodifiableMap(byName);
    }

    public static PermissionPolicy empty() {
        return EMPTY;
    }

    public Optional<Role> role(String name) {
        return Optional.ofNullable(rolesByName.get(name));
    }

    public List<Role> roles() {
        return List.copyOf(rolesByName.values());
    }

    public int size() {
        return rolesByName.size();
    }
}
