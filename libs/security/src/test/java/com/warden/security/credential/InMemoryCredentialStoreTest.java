package com.warden.security.credential;

import com.warden.security.AuthenticationException;
import com.warden.security.testing.TestCredentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryCredentialStore")
class InMemoryCredentialStoreTest {

    private MutableClock clock;
    private InMemoryCredentialStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestCredentials.NOW);
        store = new InMemoryCredentialStore(clock);
        store.register("secret-key-alpha", CredentialRecord.of("a", "Alpha", List.of("k8s:pods:list"), clock.instant()));
    }

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("returns the record and records the time of use")
        void updatesLastUsed() {
            clock.advance(Duration.ofMinutes(3));

            CredentialRecord record = store.validate("secret-key-alpha");

            assertThat(record.displayName()).isEqualTo("Alpha");
            assertThat(record.lastUsedAt()).isEqualTo(TestCredentials.NOW.plus(Duration.ofMinutes(3)));
            assertThat(store.list()).singleElement()
                    .extracting(CredentialRecord::lastUsedAt)
                    .isEqualTo(record.lastUsedAt());
        }

        @Test
        @DisplayName("unknown credential is UNKNOWN_CREDENTIAL with the generic message")
        void unknown() {
            assertThatThrownBy(() -> store.validate("secret-key-alphx"))
                    .isInstanceOfSatisfying(AuthenticationException.class, e -> {
                        assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.UNKNOWN_CREDENTIAL);
                        assertThat(e.getMessage()).isEqualTo("authentication failed");
                    });
        }

        @Test
        @DisplayName("null credential is UNKNOWN_CREDENTIAL")
        void nullCredential() {
            assertThatThrownBy(() -> store.validate(null))
                    .isInstanceOfSatisfying(AuthenticationException.class,
                            e -> assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.UNKNOWN_CREDENTIAL));
        }

        @Test
        @DisplayName("expired credential is EXPIRED and is not marked as used")
        void expired() {
            store.register("secret-key-beta", new CredentialRecord("b", "Beta", List.of(),
                    clock.instant(), clock.instant().plus(Duration.ofHours(1)), null));
            clock.advance(Duration.ofHours(1));

            assertThatThrownBy(() -> store.validate("secret-key-beta"))
                    .isInstanceOfSatisfying(AuthenticationException.class,
                            e -> assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.EXPIRED));
            assertThat(store.list()).filteredOn(r -> r.id().equals("b"))
                    .singleElement()
                    .extracting(CredentialRecord::lastUsedAt)
                    .isNull();
        }
    }

    @Nested
    @DisplayName("register() and revoke()")
    class RegisterAndRevoke {

        @Test
        @DisplayName("rejects a duplicate id")
        void duplicateId() {
            assertThatThrownBy(() -> store.register("another-secret",
                    CredentialRecord.of("a", "Again", List.of(), clock.instant())))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects a duplicate secret")
        void duplicateSecret() {
            assertThatThrownBy(() -> store.register("secret-key-alpha",
                    CredentialRecord.of("z", "Zed", List.of(), clock.instant())))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("revoked credential no longer validates")
        void revoke() {
            store.revoke("a");

            assertThat(store.list()).isEmpty();
            assertThatThrownBy(() -> store.validate("secret-key-alpha"))
                    .isInstanceOf(AuthenticationException.class);
        }

        @Test
        @DisplayName("revoking an unknown id is CredentialNotFoundException")
        void revokeUnknown() {
            assertThatThrownBy(() -> store.revoke("missing"))
                    .isInstanceOfSatisfying(CredentialNotFoundException.class,
                            e -> assertThat(e.credentialId()).isEqualTo("missing"));
        }
    }

    @Test
    @DisplayName("concurrent validation and revocation never corrupt the store")
    void concurrentValidateAndRevoke() throws Exception {
        for (int i = 0; i < 20; i++) {
            store.register("key-" + i, CredentialRecord.of("id-" + i, "Key " + i, List.of(), clock.instant()));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            tasks.add(() -> {
                start.await();
                int ok = 0;
                for (int round = 0; round < 50; round++) {
                    try {
                        store.validate("key-" + n);
                        ok++;
                    } catch (AuthenticationException e) {
                        assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.UNKNOWN_CREDENTIAL);
                    }
                }
                return ok;
            });
            if (i % 2 == 0) {
                tasks.add(() -> {
                    start.await();
                    store.revoke("id-" + n);
                    return 0;
                });
            }
        }
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (Callable<Integer> task : tasks) {
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.list()).hasSize(11);
        assertThat(store.validate("key-1").id()).isEqualTo("id-1");
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
