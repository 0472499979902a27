package com.warden.gate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ToolCallResolver")
class ToolCallResolverTest {

    private final ToolCallResolver resolver = new ToolCallResolver();

    @ParameterizedTest(name = "{0} -> {1} {2}")
    @CsvSource({
            "k8s_list_pods, list, pods",
            "k8s_scale_deployment, scale, deployments",
            "k8s_get_pod_logs, logs, pods",
            "k8s_restart_pod, restart, pods",
            "k8s_list_services, list, services",
            "fetch_pod_logs, logs, pods",
            "describe_secret, unknown, secrets",
            "create_configmap, create, configmaps",
            "ping, unknown, unknown"
    })
    @DisplayName("derives action and resource from the tool name")
    void derives(String tool, String action, String resource) {
        ToolTarget target = resolver.resolve(tool, Map.of());

        assertThat(target.action()).isEqualTo(action);
        assertThat(target.resource()).isEqualTo(resource);
    }

    @Test
    @DisplayName("takes the namespace argument, defaulting to 'default'")
    void namespace() {
        assertThat(resolver.resolve("k8s_list_pods", Map.of("namespace", "staging")).namespace()).isEqualTo("staging");
        assertThat(resolver.resolve("k8s_list_pods", Map.of("namespace", " ")).namespace()).isEqualTo("default");
        assertThat(resolver.resolve("k8s_list_pods", Map.of("namespace", 42)).namespace()).isEqualTo("default");
        assertThat(resolver.resolve("k8s_list_pods", null).namespace()).isEqualTo("default");
    }
}
