package com.warden.security.rbac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionMapper")
class PermissionMapperTest {

    private final PermissionMapper mapper = new PermissionMapper();

    @ParameterizedTest(name = "{0} {1} -> {2}")
    @CsvSource({
            "list, pods, k8s:pods:list",
            "get_logs, pods, k8s:pods:logs",
            "logs, pods, k8s:pods:logs",
            "scale, deployments, k8s:deployments:scale",
            "restart, pods, k8s:pods:restart",
            "list, services, k8s:services:list",
            "list, deployments, k8s:deployments:list",
            "delete, pods, k8s:pods:delete",
            "create, configmaps, k8s:configmaps:create"
    })
    @DisplayName("maps known pairs from the table")
    void table(String action, String resource, String expected) {
        assertThat(mapper.requiredPermission(action, resource)).isEqualTo(expected);
    }

    @Test
    @DisplayName("synthesizes unmapped pairs under the domain")
    void fallback() {
        assertThat(mapper.requiredPermission("get", "secrets")).isEqualTo("k8s:secrets:get");
        assertThat(new PermissionMapper("cloud").requiredPermission("list", "buckets"))
                .isEqualTo("cloud:buckets:list");
        assertThat(mapper.requiredPermission(null, "pods")).isEqualTo("k8s:pods:unknown");
    }

    @Test
    @DisplayName("rejects domains containing a colon")
    void rejectsBadDomain() {
        assertThatThrownBy(() -> new PermissionMapper("a:b")).isInstanceOf(IllegalArgumentException.class);
    }
}
