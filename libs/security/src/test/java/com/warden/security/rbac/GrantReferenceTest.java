package com.warden.security.rbac;

import com.warden.security.testing.TestCredentials;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GrantReference")
class GrantReferenceTest {

    @Test
    @DisplayName("classifies each form once")
    void classifies() {
        assertThat(GrantReference.classify("*", false).kind()).isEqualTo(GrantReference.Kind.SUPERUSER);
        assertThat(GrantReference.classify("k8s:*", false).kind()).isEqualTo(GrantReference.Kind.WILDCARD);
        assertThat(GrantReference.classify("k8s:pods:list", false).kind()).isEqualTo(GrantReference.Kind.PERMISSION);
        assertThat(GrantReference.classify("role:admin", true))
                .isEqualTo(new GrantReference(GrantReference.Kind.ROLE, "admin"));
        assertThat(GrantReference.classify("admin", false).kind()).isEqualTo(GrantReference.Kind.ROLE);
        assertThat(GrantReference.classify("admin", true).kind()).isEqualTo(GrantReference.Kind.PERMISSION);
    }

    @Test
    @DisplayName("wildcard covers by prefix including the colon")
    void wildcardCovers() {
        var grant = GrantReference.classify("k8s:pods:*", false);

        assertThat(grant.covers("k8s:pods:list")).isTrue();
        assertThat(grant.covers("k8s:podsx:list")).isFalse();
    }

    @Test
    @DisplayName("role references never cover a permission by themselves")
    void roleDoesNotCover() {
        assertThat(GrantReference.classify("role:admin", false).covers("role:admin")).isFalse();
    }

    @Test
    @DisplayName("role:* is a reference to a role literally named '*', not a wildcard")
    void roleStarIsNotAWildcard() {
        var grant = GrantReference.classify("role:*", false);

        assertThat(grant).isEqualTo(new GrantReference(GrantReference.Kind.ROLE, "*"));
        assertThat(grant.covers("k8s:pods:list")).isFalse();
        assertThat(new AuthorizationEngine(TestCredentials.policy())
                .check(List.of("role:*"), "k8s:pods:list", "staging").granted()).isFalse();
    }
}
