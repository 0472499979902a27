package com.warden.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WardenProperties")
class WardenPropertiesTest {

    @Test
    @DisplayName("applies defaults for optional fields")
    void defaults() {
        var token = new WardenProperties.Token("secret", null, null, Duration.ZERO);
        var security = new WardenProperties.Security(null, false, null, token, null);
        var props = new WardenProperties(new WardenProperties.Service("svc", null, null), security, null);

        assertThat(props.service().environment()).isEqualTo("development");
        assertThat(security.policyLocation()).isEqualTo("classpath:policies/rbac-policies.yaml");
        assertThat(security.permissionDomain()).isEqualTo("k8s");
        assertThat(security.apiKeys()).isEmpty();
        assertThat(token.issuer()).isEqualTo("warden");
        assertThat(token.defaultLifetime()).isEqualTo(Duration.ofHours(1));
        assertThat(token.maxLifetime()).isEqualTo(Duration.ofHours(24));
        assertThat(props.audit().async()).isFalse();
        assertThat(props.audit().queueCapacity()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("never prints secrets")
    void toStringHidesSecrets() {
        var token = new WardenProperties.Token("super-secret-signing-key", "iss", null, null);
        var key = new WardenProperties.ApiKey("k1", "Key", "demo-admin-key-67890", List.of("k8s:*"), null);

        assertThat(token.toString()).doesNotContain("super-secret-signing-key");
        assertThat(key.toString()).doesNotContain("demo-admin-key-67890").contains("demo-adm****");
    }
}
