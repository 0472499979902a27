package com.warden.security.credential;

import com.warden.observability.CredentialRedactor;
import com.warden.security.AuthScheme;
import com.warden.security.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local credential store.
 * <p>
 * Secrets are kept only as SHA-256 digests. Validation compares the presented digest against
 * every stored digest with {@link MessageDigest#isEqual(byte[], byte[])} and never stops early,
 * so the time taken does not depend on which entry (if any) matched.
 * <p>
 * A single lock guards all reads and writes.
 */
public final class InMemoryCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

    private final List<StoredCredential> credentials = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryCredentialStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCredentialStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    @Override
    public CredentialRecord validate(String rawCredential) {
        byte[] presented = digest(rawCredential == null ? "" : rawCredential);
        lock.lock();
        try {
            StoredCredential found = null;
            for (StoredCredential stored : credentials) {
                boolean match = MessageDigest.isEqual(presented, stored.digest);
                if (match && found == null) {
                    found = stored;
                }
            }

            if (found == null) {
                log.warn("Invalid credential attempted: prefix={}", CredentialRedactor.mask(rawCredential));
                throw new AuthenticationException(AuthenticationException.Reason.UNKNOWN_CREDENTIAL,
                        AuthScheme.KEY.value());
            }

            Instant now = clock.instant();
            if (found.record.isExpiredAt(now)) {
                log.warn("Expired credential attempted: keyId={}", found.record.id());
                throw new AuthenticationException(AuthenticationException.Reason.EXPIRED, AuthScheme.KEY.value());
            }

            found.record = found.record.withLastUsedAt(now);
            log.debug("Credential validated: keyId={}, name={}", found.record.id(), found.record.displayName());
            return found.record;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void revoke(String credentialId) {
        lock.lock();
        try {
            Iterator<StoredCredential> it = credentials.iterator();
            while (it.hasNext()) {
                if (it.next().record.id().equals(credentialId)) {
                    it.remove();
                    log.info("Credential revoked: keyId={}", credentialId);
                    return;
                }
            }
        } finally {
            lock.unlock();
        }
        throw new CredentialNotFoundException(credentialId);
    }

    @Override
    public void register(String rawCredential, CredentialRecord record) {
        if (rawCredential == null || rawCredential.isBlank()) {
            throw new IllegalArgumentException("rawCredential must not be blank");
        }
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        byte[] digest = digest(rawCredential);
        lock.lock();
        try {
            for (StoredCredential stored : credentials) {
                if (stored.record.id().equals(record.id())) {
                    throw new IllegalArgumentException("credential id already registered: " + record.id());
                }
                if (MessageDigest.isEqual(digest, stored.digest)) {
                    throw new IllegalArgumentException("credential secret already registered");
                }
            }
            credentials.add(new StoredCredential(digest, record));
            log.info("Credential registered: keyId={}, name={}, permissions={}",
                    record.id(), record.displayName(), record.permissions().size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<CredentialRecord> list() {
        lock.lock();
        try {
            return credentials.stream().map(c -> c.record).toList();
        } finally {
            lock.unlock();
        }
    }

    private static byte[] digest(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class StoredCredential {
        private final byte[] digest;
        private CredentialRecord record;

        private StoredCredential(byte[] digest, CredentialRecord record) {
            this.digest = digest;
            this.record = record;
        }
    }
}
