package com.warden.security.credential;

/**
 * Thrown when revoking a credential id that is not registered.
 */
public class CredentialNotFoundException extends RuntimeException {

    private final String credentialId;

    public CredentialNotFoundException(String credentialId) {
        super("credential not found: %s".formatted(credentialId));
        this.credentialId = credentialId;
    }

    public String credentialId() {
        return credentialId;
    }
}
