package com.warden.security.rbac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionPolicyLoader")
class PermissionPolicyLoaderTest {

    @Nested
    @DisplayName("valid documents")
    class ValidDocuments {

        @Test
        @DisplayName("loads roles from the classpath")
        void classpath() {
            PermissionPolicy policy = PermissionPolicyLoader.loadFromClasspath("policies/test-policies.yaml");

            assertThat(policy.size()).isEqualTo(3);
            Role developer = policy.role("developer").orElseThrow();
            assertThat(developer.permissions()).containsExactly("k8s:pods:list", "k8s:pods:logs");
            assertThat(developer.namespaces()).containsExactly("staging");
            assertThat(policy.role("admin").orElseThrow().allowsNamespace("anything")).isTrue();
        }

        @Test
        @DisplayName("loads from a file and ignores unknown fields")
        void file(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("policy.yaml");
            Files.writeString(file, """
                    version: 2
                    roles:
                      - name: viewer
                        permissions: ["k8s:pods:list"]
                        owner: platform
                    """);

            PermissionPolicy policy = PermissionPolicyLoader.load(file);

            assertThat(policy.role("viewer")).isPresent();
            assertThat(policy.role("viewer").get().namespaces()).isEmpty();
        }
    }

    @Nested
    @DisplayName("invalid documents")
    class InvalidDocuments {

        @Test
        @DisplayName("syntax error")
        void syntaxError() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("roles: [ { name: x"))
                    .isInstanceOf(PolicyLoadException.class);
        }

        @Test
        @DisplayName("missing roles")
        void missingRoles() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("other: 1"))
                    .isInstanceOf(PolicyLoadException.class)
                    .hasMessageContaining("roles");
        }

        @Test
        @DisplayName("role without a name")
        void namelessRole() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("""
                    roles:
                      - description: nameless
                        permissions: ["k8s:pods:list"]
                    """))
                    .isInstanceOf(PolicyLoadException.class)
                    .hasMessageContaining("without a name");
        }

        @Test
        @DisplayName("duplicate role")
        void duplicateRole() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("""
                    roles:
                      - name: dev
                      - name: dev
                    """))
                    .isInstanceOf(PolicyLoadException.class)
                    .hasMessageContaining("duplicate role 'dev'");
        }

        @Test
        @DisplayName("empty permission entry")
        void nullPermission() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("""
                    roles:
                      - name: dev
                        permissions: ["k8s:pods:list", null]
                    """))
                    .isInstanceOf(PolicyLoadException.class);
        }

        @Test
        @DisplayName("wildcard role reference")
        void wildcardRoleReference() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("""
                    roles:
                      - name: lead
                        permissions: ["role:*"]
                    """))
                    .isInstanceOfSatisfying(PolicyLoadException.class,
                            e -> assertThat(e.getMessage()).contains("wildcard role reference"));
        }

        @Test
        @DisplayName("role named with a wildcard")
        void wildcardRoleName() {
            assertThatThrownBy(() -> PermissionPolicyLoader.parse("""
                    roles:
                      - name: "*"
                        permissions: ["*"]
                    """))
                    .isInstanceOf(PolicyLoadException.class);
        }

        @Test
        @DisplayName("missing classpath resource")
        void missingResource() {
            assertThatThrownBy(() -> PermissionPolicyLoader.loadFromClasspath("policies/none.yaml"))
                    .isInstanceOfSatisfying(PolicyLoadException.class,
                            e -> assertThat(e.source()).isEqualTo("policies/none.yaml"));
        }
    }
}
