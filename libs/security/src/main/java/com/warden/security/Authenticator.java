package com.warden.security;

/**
 * Turns a raw credential into an {@link Identity}.
 * <p>
 * Implementations must fail with {@link AuthenticationException} and keep the specific reason
 * out of the exception message.
 */
public interface Authenticator {

    /** Canonical scheme name this authenticator handles. */
    String scheme();

    Identity authenticate(String rawCredential);
}
