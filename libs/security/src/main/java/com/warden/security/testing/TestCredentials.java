package com.warden.security.testing;

import com.warden.security.credential.CredentialRecord;
import com.warden.security.credential.InMemoryCredentialStore;
import com.warden.security.rbac.PermissionPolicy;
import com.warden.security.rbac.Role;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Ready-made credentials and policy for tests in other modules.
 */
public final class TestCredentials {

    public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final String ADMIN_KEY = "demo-admin-key";
    public static final String ADMIN_KEY_ID = "admin-1";
    public static final String ADMIN_NAME = "Admin Key";

    public static final String DEV_KEY = "demo-dev-key";
    public static final String DEV_KEY_ID = "dev-1";
    public static final String DEV_NAME = "Developer Key";

    public static final String TOKEN_SECRET = "test-signing-secret-with-at-least-32-bytes!";
    public static final String TOKEN_ISSUER = "warden-test";

    private TestCredentials() {
        // utility class
    }

    /** {@code developer}: list and read logs of pods in staging only. */
    public static PermissionPolicy policy() {
        return new PermissionPolicy(List.of(
                new Role("developer", "Developer access", List.of("k8s:pods:list", "k8s:pods:logs"),
                        List.of("staging")),
                new Role("viewer", "Read-only everywhere", List.of("k8s:pods:list", "k8s:services:list"),
                        List.of()),
                new Role("operator", "Operations", List.of("k8s:deployments:*", "k8s:pods:*"),
                        List.of("production", "staging"))));
    }

    /** Store with the admin key ({@code k8s:*}) and the developer key (role developer). */
    public static InMemoryCredentialStore store(Clock clock) {
        InMemoryCredentialStore store = new InMemoryCredentialStore(clock);
        store.register(ADMIN_KEY, CredentialRecord.of(ADMIN_KEY_ID, ADMIN_NAME, List.of("k8s:*"), clock.instant()));
        store.register(DEV_KEY, CredentialRecord.of(DEV_KEY_ID, DEV_NAME, List.of("developer"), clock.instant()));
        return store;
    }
}
