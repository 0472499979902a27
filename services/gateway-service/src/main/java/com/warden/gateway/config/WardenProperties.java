package com.warden.gateway.config;

import com.warden.observability.CredentialRedactor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration bound from the {@code warden.*} prefix.
 *
 * <pre>
 * warden:
 *   service:
 *     name: warden-gateway
 *   security:
 *     policy-location: classpath:policies/rbac-policies.yaml
 *     require-role-prefix: false
 *     token:
 *       secret: ${WARDEN_TOKEN_SECRET}
 *     api-keys:
 *       - id: admin-key
 *         name: Admin Key
 *         key: ${WARDEN_ADMIN_KEY}
 *         permissions: ["k8s:*", "warden:*"]
 *   audit:
 *     async: true
 * </pre>
 *
 * <p>Compact constructors apply defaults before Bean Validation runs.
 */
@ConfigurationProperties(prefix = "warden")
@Validated
public record WardenProperties(
        @NotNull @Valid Service service, @NotNull @Valid Security security, @Valid Audit audit) {

    public WardenProperties {
        if (audit == null) {
            audit = new Audit(false, 0);
        }
    }

    /**
     * @param name service name used in logs, metrics and the info endpoint
     * @param environment deployment environment
     * @param description free text for the info endpoint
     */
    public record Service(@NotBlank String name, String environment, String description) {

        public Service {
            if (environment == null || environment.isBlank()) {
                environment = "development";
            }
        }
    }

    /**
     * @param policyLocation Spring resource location of the RBAC policy YAML
     * @param requireRolePrefix when true, only {@code role:<name>} references roles
     * @param permissionDomain domain used for unmapped action/resource pairs
     * @param token signed-token settings
     * @param apiKeys keys registered at startup
     */
    public record Security(
            String policyLocation,
            boolean requireRolePrefix,
            String permissionDomain,
            @NotNull @Valid Token token,
            List<@Valid ApiKey> apiKeys) {

        public Security {
            if (policyLocation == null || policyLocation.isBlank()) {
                policyLocation = "classpath:policies/rbac-policies.yaml";
            }
            if (permissionDomain == null || permissionDomain.isBlank()) {
                permissionDomain = "k8s";
            }
            apiKeys = apiKeys == null ? List.of() : List.copyOf(apiKeys);
        }
    }

    /**
     * @param secret HMAC secret, at least 32 bytes
     * @param issuer {@code iss} claim written and expected
     * @param defaultLifetime lifetime when a request does not ask for one
     * @param maxLifetime upper bound for requested lifetimes
     */
    public record Token(
            @NotBlank String secret, String issuer, Duration defaultLifetime, Duration maxLifetime) {

        public Token {
            if (issuer == null || issuer.isBlank()) {
                issuer = "warden";
            }
            if (defaultLifetime == null || defaultLifetime.isZero() || defaultLifetime.isNegative()) {
                defaultLifetime = Duration.ofHours(1);
            }
            if (maxLifetime == null || maxLifetime.isZero() || maxLifetime.isNegative()) {
                maxLifetime = Duration.ofHours(24);
            }
        }

        @Override
        public String toString() {
            return "Token[secret=" + CredentialRedactor.REDACTED + ", issuer=" + issuer
                    + ", defaultLifetime=" + defaultLifetime + ", maxLifetime=" + maxLifetime + "]";
        }
    }

    public record ApiKey(
            @NotBlank String id,
            @NotBlank String name,
            @NotBlank String key,
            List<String> permissions,
            Instant expiresAt) {

        public ApiKey {
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
        }

        @Override
        public String toString() {
            return "ApiKey[id=" + id + ", name=" + name + ", key=" + CredentialRedactor.mask(key)
                    + ", permissions=" + permissions + ", expiresAt=" + expiresAt + "]";
        }
    }

    /**
     * @param async write audit lines on a background thread
     * @param queueCapacity bounded queue size for async writing
     */
    public record Audit(boolean async, int queueCapacity) {

        public Audit {
            if (queueCapacity <= 0) {
                queueCapacity = 10_000;
            }
        }
    }
}
