package com.warden.security.rbac;

import java.util.List;

/**
 * A named bundle of permissions, optionally confined to namespaces.
 *
 * @param name        unique role name
 * @param description free text
 * @param permissions permission strings; wildcards allowed
 * @param namespaces  namespaces the role applies in; empty means every namespace
 */
public record Role(
        String name,
        String description,
        List<String> permissions,
        List<String> namespaces
) {

    public static final String ANY_NAMESPACE = "*";

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description == null ? "" : description;
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
    }

    /** True if the namespace list is empty or contains the namespace or {@code "*"}. */
    public boolean allowsNamespace(String namespace) {
        if (namespaces.isEmpty()) {
            return true;
        }
        return namespaces.contains(ANY_NAMESPACE) || namespaces.contains(namespace);
    }
}
