package com.warden.security;

import com.warden.security.testing.TestCredentials;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenAuthenticator")
class TokenAuthenticatorTest {

    private static final Instant NOW = TestCredentials.NOW;

    private static TokenAuthenticator at(Instant instant) {
        return new TokenAuthenticator(TestCredentials.TOKEN_SECRET, TestCredentials.TOKEN_ISSUER,
                Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static AuthenticationException.Reason reasonOf(Runnable call) {
        try {
            call.run();
        } catch (AuthenticationException e) {
            assertThat(e.getMessage()).isEqualTo(AuthenticationException.GENERIC_MESSAGE);
            assertThat(e.scheme()).isEqualTo("token");
            return e.reason();
        }
        throw new AssertionError("expected AuthenticationException");
    }

    private static String b64(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("issue and authenticate")
    class IssueAndAuthenticate {

        @Test
        @DisplayName("maps username, permissions and timestamps onto the identity")
        void mapsClaims() {
            var authenticator = at(NOW);
            String token = authenticator.issueToken("u-42", "alice", List.of("k8s:pods:list", "developer"),
                    Duration.ofHours(1));

            Identity identity = authenticator.authenticate(token);

            assertThat(identity.scheme()).isEqualTo("token");
            assertThat(identity.subject()).isEqualTo("alice");
            assertThat(identity.permissions()).containsExactly("k8s:pods:list", "developer");
            assertThat(identity.attributes())
                    .containsEntry(Identity.ATTR_USER_ID, "u-42")
                    .containsEntry(Identity.ATTR_ISSUED_AT, NOW)
                    .containsEntry(Identity.ATTR_EXPIRES_AT, NOW.plus(Duration.ofHours(1)));
        }

        @Test
        @DisplayName("falls back to the user id when no username is given")
        void usernameFallback() {
            var authenticator = at(NOW);
            String token = authenticator.issueToken("u-42", null, List.of(), Duration.ofMinutes(5));

            assertThat(authenticator.authenticate(token).subject()).isEqualTo("u-42");
        }

        @Test
        @DisplayName("rejects non-positive lifetimes")
        void rejectsNonPositiveLifetime() {
            var authenticator = at(NOW);

            assertThatThrownBy(() -> authenticator.issueToken("u", "u", List.of(), Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> authenticator.issueToken("u", "u", List.of(), Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects short secrets")
        void rejectsShortSecret() {
            assertThatThrownBy(() -> new TokenAuthenticator("short", "iss", Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("expired token with a valid signature is EXPIRED")
        void expired() {
            String token = at(NOW).issueToken("u", "alice", List.of("k8s:*"), Duration.ofMinutes(5));

            assertThat(reasonOf(() -> at(NOW.plus(Duration.ofMinutes(10))).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.EXPIRED);
        }

        @Test
        @DisplayName("token used before its not-before is NOT_YET_VALID")
        void notYetValid() {
            String token = at(NOW.plus(Duration.ofHours(1))).issueToken("u", "alice", List.of(), Duration.ofHours(2));

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.NOT_YET_VALID);
        }

        @Test
        @DisplayName("token signed with another secret is INVALID_SIGNATURE")
        void wrongSecret() {
            var other = new TokenAuthenticator("another-secret-that-is-also-32-bytes-long",
                    TestCredentials.TOKEN_ISSUER, Clock.fixed(NOW, ZoneOffset.UTC));
            String token = other.issueToken("u", "alice", List.of(), Duration.ofHours(1));

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("tampered payload is INVALID_SIGNATURE")
        void tampered() {
            String token = at(NOW).issueToken("u", "alice", List.of("k8s:pods:list"), Duration.ofHours(1));
            String[] parts = token.split("\\.");
            String forgedPayload = b64("{\"sub\":\"u\",\"iss\":\"warden-test\",\"permissions\":[\"*\"],"
                    + "\"exp\":" + NOW.plus(Duration.ofHours(1)).getEpochSecond() + "}");
            String forged = parts[0] + "." + forgedPayload + "." + parts[2];

            assertThat(reasonOf(() -> at(NOW).authenticate(forged)))
                    .isEqualTo(AuthenticationException.Reason.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("alg 'none' is ALGORITHM_MISMATCH")
        void algNone() {
            String token = b64("{\"alg\":\"none\"}") + "." + b64("{\"sub\":\"u\",\"permissions\":[\"*\"]}") + ".";

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.ALGORITHM_MISMATCH);
        }

        @Test
        @DisplayName("public-key algorithm is ALGORITHM_MISMATCH")
        void algRs256() {
            String token = b64("{\"alg\":\"RS256\",\"typ\":\"JWT\"}") + "." + b64("{\"sub\":\"u\"}") + ".c2ln";

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.ALGORITHM_MISMATCH);
        }

        @Test
        @DisplayName("garbage is MALFORMED_TOKEN")
        void garbage() {
            assertThat(reasonOf(() -> at(NOW).authenticate("not-a-token")))
                    .isEqualTo(AuthenticationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("non-string alg header is MALFORMED_TOKEN")
        void numericAlg() {
            String token = b64("{\"alg\":123}") + "." + b64("{}") + ".c2ln";

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("correctly signed payload that is not JSON is MALFORMED_TOKEN")
        void signedNonJsonPayload() throws JoseException {
            var jws = new JsonWebSignature();
            jws.setPayload("this is not json");
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
            jws.setKey(new HmacKey(TestCredentials.TOKEN_SECRET.getBytes(StandardCharsets.UTF_8)));
            String token = jws.getCompactSerialization();

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("token from another issuer is INVALID_CLAIMS")
        void wrongIssuer() {
            var other = new TokenAuthenticator(TestCredentials.TOKEN_SECRET, "someone-else",
                    Clock.fixed(NOW, ZoneOffset.UTC));
            String token = other.issueToken("u", "alice", List.of(), Duration.ofHours(1));

            assertThat(reasonOf(() -> at(NOW).authenticate(token)))
                    .isEqualTo(AuthenticationException.Reason.INVALID_CLAIMS);
        }
    }
}
