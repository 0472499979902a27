package com.warden.security.rbac;

import java.util.Locale;
import java.util.Map;

/**
 * Maps an (action, resource) pair to the permission it requires.
 * <p>
 * Known pairs come from a fixed table. Anything else becomes {@code <domain>:<resource>:<action>}.
 */
public final class PermissionMapper {

    public static final String DEFAULT_DOMAIN = "k8s";

    private static final Map<String, String> TABLE = Map.of(
            key("list", "pods"), "k8s:pods:list",
            key("get_logs", "pods"), "k8s:pods:logs",
            key("logs", "pods"), "k8s:pods:logs",
            key("scale", "deployments"), "k8s:deployments:scale",
            key("restart", "pods"), "k8s:pods:restart",
            key("list", "services"), "k8s:services:list",
            key("list", "deployments"), "k8s:deployments:list",
            key("delete", "pods"), "k8s:pods:delete",
            key("create", "configmaps"), "k8s:configmaps:create");

    private final String domain;

    public PermissionMapper() {
        this(DEFAULT_DOMAIN);
    }

    public PermissionMapper(String domain) {
        if (domain == null || domain.isBlank() || domain.contains(":")) {
            throw new IllegalArgumentException("domain must be a non-blank token without ':'");
        }
        this.domain = domain;
    }

    public String requiredPermission(String action, String resource) {
        String normalizedAction = normalize(action);
        String normalizedResource = normalize(resource);
        String mapped = TABLE.get(key(normalizedAction, normalizedResource));
        if (mapped != null) {
            return mapped;
        }
        return "%s:%s:%s".formatted(domain, normalizedResource, normalizedAction);
    }

    public String domain() {
        return domain;
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.strip().toLowerCase(Locale.ROOT);
    }

    private static String key(String action, String resource) {
        return action + "/" + resource;
    }
}
