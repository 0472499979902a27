package com.warden.security;

import com.warden.observability.CredentialRedactor;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwx.JsonWebStructure;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Authenticates HMAC-SHA256 signed JWTs and issues new ones.
 * <p>
 * Only the HMAC-SHA2 algorithm family is accepted, which rules out {@code none} and public-key
 * algorithm substitution. Expiry is checked twice: by jose4j at the clock's evaluation time, then
 * again here against the same clock.
 */
public final class TokenAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_PERMISSIONS = "permissions";

    /** HS256 needs at least 256 bits of key material. */
    public static final int MIN_SECRET_BYTES = 32;

    private static final Set<String> HMAC_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.HMAC_SHA256,
            AlgorithmIdentifiers.HMAC_SHA384,
            AlgorithmIdentifiers.HMAC_SHA512);

    private final HmacKey key;
    private final String issuer;
    private final Clock clock;

    public TokenAuthenticator(String secret, String issuer, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.key = new HmacKey(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.clock = clock;
    }

    @Override
    public String scheme() {
        return AuthScheme.TOKEN.value();
    }

    @Override
    public Identity authenticate(String rawCredential) {
        if (rawCredential == null || rawCredential.isBlank()) {
            throw fail(AuthenticationException.Reason.MALFORMED_TOKEN, rawCredential, null);
        }
        requireHmacAlgorithm(rawCredential);

        JwtClaims claims;
        try {
            claims = consumer().processToClaims(rawCredential);
        } catch (InvalidJwtException e) {
            throw fail(classify(e), rawCredential, e);
        }

        try {
            NumericDate expiration = claims.getExpirationTime();
            Instant expiresAt = Instant.ofEpochMilli(expiration.getValueInMillis());
            if (!clock.instant().isBefore(expiresAt)) {
                throw fail(AuthenticationException.Reason.EXPIRED, rawCredential, null);
            }

            String subject = claims.getSubject();
            String username = claims.hasClaim(CLAIM_USERNAME)
                    ? claims.getStringClaimValue(CLAIM_USERNAME)
                    : subject;
            List<String> permissions = claims.hasClaim(CLAIM_PERMISSIONS)
                    ? claims.getStringListClaimValue(CLAIM_PERMISSIONS)
                    : List.of();

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(Identity.ATTR_USER_ID, claims.hasClaim(CLAIM_USER_ID)
                    ? claims.getStringClaimValue(CLAIM_USER_ID)
                    : subject);
            if (claims.getIssuedAt() != null) {
                attributes.put(Identity.ATTR_ISSUED_AT, Instant.ofEpochMilli(claims.getIssuedAt().getValueInMillis()));
            }
            attributes.put(Identity.ATTR_EXPIRES_AT, expiresAt);

            return new Identity(scheme(), username == null || username.isBlank() ? subject : username,
                    permissions, attributes);
        } catch (MalformedClaimException | IllegalArgumentException e) {
            throw fail(AuthenticationException.Reason.INVALID_CLAIMS, rawCredential, e);
        }
    }

    /**
     * Issues a signed token.
     *
     * @param userId      becomes {@code sub} and {@code user_id}
     * @param username    becomes {@code username} and the identity subject
     * @param permissions permission strings or role references
     * @param lifetime    time until expiry, must be positive
     * @return compact JWS serialization
     */
    public String issueToken(String userId, String username, List<String> permissions, Duration lifetime) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (lifetime == null || lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("lifetime must be positive");
        }

        long nowMillis = clock.millis();
        JwtClaims claims = new JwtClaims();
        claims.setIssuer(issuer);
        claims.setSubject(userId);
        claims.setClaim(CLAIM_USER_ID, userId);
        claims.setClaim(CLAIM_USERNAME, username == null || username.isBlank() ? userId : username);
        claims.setStringListClaim(CLAIM_PERMISSIONS, permissions == null ? List.of() : List.copyOf(permissions));
        claims.setIssuedAt(NumericDate.fromMilliseconds(nowMillis));
        claims.setNotBefore(NumericDate.fromMilliseconds(nowMillis));
        claims.setExpirationTime(NumericDate.fromMilliseconds(nowMillis + lifetime.toMillis()));

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            String token = jws.getCompactSerialization();
            log.info("Token issued: userId={}, lifetime={}", userId, lifetime);
            return token;
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    public String issuer() {
        return issuer;
    }

    private void requireHmacAlgorithm(String token) {
        String algorithm;
        try {
            JsonWebStructure structure = JsonWebStructure.fromCompactSerialization(token);
            if (!(structure instanceof JsonWebSignature)) {
                throw fail(AuthenticationException.Reason.ALGORITHM_MISMATCH, token, null);
            }
            algorithm = structure.getAlgorithmHeaderValue();
        } catch (JoseException e) {
            throw fail(AuthenticationException.Reason.MALFORMED_TOKEN, token, e);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            // header values of the wrong JSON type, e.g. a numeric alg
            throw fail(AuthenticationException.Reason.MALFORMED_TOKEN, token, e);
        }
        if (algorithm == null || !HMAC_ALGORITHMS.contains(algorithm)) {
            log.warn("Token rejected: unexpected algorithm {}", algorithm);
            throw fail(AuthenticationException.Reason.ALGORITHM_MISMATCH, token, null);
        }
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
                .setVerificationKey(key)
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT,
                        HMAC_ALGORITHMS.toArray(new String[0])))
                .setRequireExpirationTime()
                .setRequireSubject()
                .setExpectedIssuer(issuer)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setAllowedClockSkewInSeconds(0)
                .build();
    }

    private static AuthenticationException.Reason classify(InvalidJwtException e) {
        if (e.hasExpired()) {
            return AuthenticationException.Reason.EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return AuthenticationException.Reason.NOT_YET_VALID;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return AuthenticationException.Reason.INVALID_SIGNATURE;
        }
        if (e.hasErrorCode(ErrorCodes.JSON_INVALID)) {
            return AuthenticationException.Reason.MALFORMED_TOKEN;
        }
        return AuthenticationException.Reason.INVALID_CLAIMS;
    }

    private AuthenticationException fail(AuthenticationException.Reason reason, String token, Throwable cause) {
        log.warn("Token authentication failed: reason={}, token={}", reason.detail(), CredentialRedactor.mask(token));
        return new AuthenticationException(reason, scheme(), cause);
    }
}
