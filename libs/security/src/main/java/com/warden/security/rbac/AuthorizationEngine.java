package com.warden.security.rbac;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides whether a set of held grants covers a required permission in a namespace.
 * <p>
 * Check order, first match wins:
 * <ol>
 *   <li>held exact permission</li>
 *   <li>held wildcard whose prefix matches</li>
 *   <li>held superuser {@code *}</li>
 *   <li>each held role, resolved by name (unknown names skipped), checked with 1 to 3 against its
 *       own permissions, and granting only if its namespace list allows the namespace</li>
 * </ol>
 * Anything else is denied. Direct grants are not namespace-scoped.
 * <p>
 * The policy can be swapped with {@link #reload(PermissionPolicy)}; a check sees either the old or
 * the new policy, never a mix.
 */
public final class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final AtomicReference<PermissionPolicy> policy;
    private final boolean requireRolePrefix;

    public AuthorizationEngine(PermissionPolicy policy) {
        this(policy, false);
    }

    public AuthorizationEngine(PermissionPolicy policy, boolean requireRolePrefix) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.policy = new AtomicReference<>(policy);
        this.requireRolePrefix = requireRolePrefix;
    }

    public AuthorizationDecision check(Collection<String> held, String required, String namespace) {
        if (required == null || required.isBlank()) {
            throw new IllegalArgumentException("required permission must not be blank");
        }
        if (held == null || held.isEmpty()) {
            log.warn("Permission denied: no permissions held, required={}, namespace={}", required, namespace);
            return AuthorizationDecision.deny(required, namespace);
        }

        List<GrantReference> roleRefs = new ArrayList<>();
        for (String raw : held) {
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            GrantReference grant = GrantReference.classify(raw, requireRolePrefix);
            if (grant.kind() == GrantReference.Kind.ROLE) {
                roleRefs.add(grant);
            } else if (grant.covers(required)) {
                log.debug("Permission granted directly: grant={}, required={}, namespace={}",
                        raw, required, namespace);
                return AuthorizationDecision.grant(required, namespace, raw);
            }
        }

        PermissionPolicy current = policy.get();
        for (GrantReference ref : roleRefs) {
            Optional<Role> role = current.role(ref.value());
            if (role.isEmpty()) {
                log.debug("Unknown role skipped: {}", ref.value());
                continue;
            }
            if (roleCovers(role.get(), required)) {
                if (role.get().allowsNamespace(namespace)) {
                    log.debug("Permission granted by role: role={}, required={}, namespace={}",
                            ref.value(), required, namespace);
                    return AuthorizationDecision.grant(required, namespace, GrantReference.ROLE_PREFIX + ref.value());
                }
                log.debug("Role {} covers {} but not namespace {}", ref.value(), required, namespace);
            }
        }

        log.warn("Permission denied: held={}, required={}, namespace={}", held, required, namespace);
        return AuthorizationDecision.deny(required, namespace);
    }

    /** Replaces the policy atomically. */
    public void reload(PermissionPolicy newPolicy) {
        if (newPolicy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        policy.set(newPolicy);
        log.info("Permission policy reloaded: roles={}", newPolicy.size());
    }

    public PermissionPolicy policy() {
        return policy.get();
    }

    private static boolean roleCovers(Role role, String required) {
        for (String permission : role.permissions()) {
            GrantReference grant = GrantReference.classify(permission, true);
            if (grant.covers(required)) {
                return true;
            }
        }
        return false;
    }
}
