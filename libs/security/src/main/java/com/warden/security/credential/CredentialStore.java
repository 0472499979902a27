package com.warden.security.credential;

import com.warden.security.AuthenticationException;

import java.util.List;

/**
 * Holds opaque credentials and their metadata.
 */
public interface CredentialStore {

    /**
     * Validates a raw credential and records its use.
     *
     * @return snapshot of the record after {@code lastUsedAt} was updated
     * @throws AuthenticationException with reason {@code UNKNOWN_CREDENTIAL} or {@code EXPIRED}
     */
    CredentialRecord validate(String rawCredential);

    /**
     * Removes a credential by id.
     *
     * @throws CredentialNotFoundException if no credential has that id
     */
    void revoke(String credentialId);

    /**
     * Registers a credential.
     *
     * @throws IllegalArgumentException if the id or the secret is already registered
     */
    void register(String rawCredential, CredentialRecord record);

    /** Snapshot of all registered records. */
    List<CredentialRecord> list();
}
