package com.warden.security;

import com.warden.security.credential.CredentialRecord;
import com.warden.security.credential.CredentialStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authenticates opaque keys against a {@link CredentialStore}.
 */
public final class ApiKeyAuthenticator implements Authenticator {

    private final CredentialStore store;

    public ApiKeyAuthenticator(CredentialStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
    }

    @Override
    public String scheme() {
        return AuthScheme.KEY.value();
    }

    @Override
    public Identity authenticate(String rawCredential) {
        CredentialRecord record = store.validate(rawCredential);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Identity.ATTR_KEY_ID, record.id());
        attributes.put(Identity.ATTR_LAST_USED, record.lastUsedAt());
        return new Identity(scheme(), record.displayName(), record.permissions(), attributes);
    }
}
