package com.warden.security.rbac;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a permission policy from YAML.
 * <pre>
 * roles:
 *   - name: developer
 *     description: Read access to pods
 *     permissions: ["k8s:pods:list", "k8s:pods:logs"]
 *     namespaces: ["staging"]
 * </pre>
 */
public final class PermissionPolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PermissionPolicyLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private PermissionPolicyLoader() {
        // utility class
    }

    public static PermissionPolicy parse(String yaml) {
        if (yaml == null) {
            throw new PolicyLoadException("<string>", "document is null");
        }
        try {
            return toPolicy("<string>", YAML.readValue(yaml, PolicyDocument.class));
        } catch (IOException e) {
            throw new PolicyLoadException("<string>", e.getMessage(), e);
        }
    }

    public static PermissionPolicy load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(path.toString(), in);
        } catch (IOException e) {
            throw new PolicyLoadException(path.toString(), e.getMessage(), e);
        }
    }

    /**
     * Loads a policy from the classpath (e.g., {@code "policies/rbac-policies.yaml"}).
     */
    public static PermissionPolicy loadFromClasspath(String location) {
        String resource = location.startsWith("/") ? location.substring(1) : location;
        InputStream in = PermissionPolicyLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new PolicyLoadException(location, "resource not found");
        }
        try (in) {
            return load(location, in);
        } catch (IOException e) {
            throw new PolicyLoadException(location, e.getMessage(), e);
        }
    }

    public static PermissionPolicy load(String source, InputStream in) {
        try {
            return toPolicy(source, YAML.readValue(in, PolicyDocument.class));
        } catch (IOException e) {
            throw new PolicyLoadException(source, e.getMessage(), e);
        }
    }

    private static boolean isRoleWildcard(String permission) {
        return permission.startsWith(GrantReference.ROLE_PREFIX) && permission.contains("*");
    }

    private static PermissionPolicy toPolicy(String source, PolicyDocument document) {
        if (document == null || document.roles() == null) {
            throw new PolicyLoadException(source, "missing 'roles'");
        }
        List<Role> roles = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (RoleDocument doc : document.roles()) {
            if (doc == null || doc.name() == null || doc.name().isBlank()) {
                throw new PolicyLoadException(source, "role without a name");
            }
            if (doc.name().contains("*")) {
                throw new PolicyLoadException(source, "role name '" + doc.name() + "' must not contain '*'");
            }
            if (!names.add(doc.name())) {
                throw new PolicyLoadException(source, "duplicate role '" + doc.name() + "'");
            }
            if (doc.permissions() != null && doc.permissions().contains(null)) {
                throw new PolicyLoadException(source, "role '" + doc.name() + "' has an empty permission entry");
            }
            if (doc.permissions() != null
                    && doc.permissions().stream().anyMatch(PermissionPolicyLoader::isRoleWildcard)) {
                throw new PolicyLoadException(source, "role '" + doc.name() + "' uses a wildcard role reference");
            }
            if (doc.namespaces() != null && doc.namespaces().contains(null)) {
                throw new PolicyLoadException(source, "role '" + doc.name() + "' has an empty namespace entry");
            }
            roles.add(new Role(doc.name(), doc.description(), doc.permissions(), doc.namespaces()));
        }
        log.info("Permission policy loaded: source={}, roles={}", source, roles.size());
        return new PermissionPolicy(roles);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PolicyDocument(List<RoleDocument> roles) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RoleDocument(String name, String description, List<String> permissions, List<String> namespaces) {
    }
}
