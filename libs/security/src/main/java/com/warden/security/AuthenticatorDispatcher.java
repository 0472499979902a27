package com.warden.security;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes a credential to the {@link Authenticator} registered for its scheme.
 * <p>
 * The scheme table is fixed at construction.
 */
public final class AuthenticatorDispatcher {

    private final Map<String, Authenticator> authenticators;

    public AuthenticatorDispatcher(List<? extends Authenticator> authenticators) {
        if (authenticators == null || authenticators.isEmpty()) {
            throw new IllegalArgumentException("at least one authenticator is required");
        }
        Map<String, Authenticator> byScheme = new HashMap<>();
        for (Authenticator authenticator : authenticators) {
            if (byScheme.putIfAbsent(authenticator.scheme(), authenticator) != null) {
                throw new IllegalArgumentException("duplicate authenticator for scheme: " + authenticator.scheme());
            }
        }
        this.authenticators = Map.copyOf(byScheme);
    }

    /**
     * @throws AuthenticationException with reason {@code UNSUPPORTED_SCHEME} when no authenticator
     *                                 is registered for the scheme, or whatever the authenticator throws
     */
    public Identity authenticate(String scheme, String rawCredential) {
        Authenticator authenticator = scheme == null ? null : authenticators.get(scheme);
        if (authenticator == null) {
            throw new AuthenticationException(AuthenticationException.Reason.UNSUPPORTED_SCHEME, scheme);
        }
        return authenticator.authenticate(rawCredential);
    }

    public Set<String> schemes() {
        return authenticators.keySet();
    }
}
