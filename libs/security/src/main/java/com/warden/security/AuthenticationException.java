package com.warden.security;

/**
 * Thrown when a caller cannot be authenticated.
 * <p>
 * {@link #getMessage()} is always the generic {@value #GENERIC_MESSAGE} so that nothing about the
 * failed check leaks to an unauthenticated caller. The specific {@link Reason} is available to
 * the audit trail and the logs through {@link #reason()}.
 */
public class AuthenticationException extends RuntimeException {

    public static final String GENERIC_MESSAGE = "authentication failed";

    /** Why authentication failed. Internal only. */
    public enum Reason {
        MISSING_HEADER("missing authorization header"),
        MALFORMED_HEADER("malformed header"),
        UNSUPPORTED_SCHEME("unsupported scheme"),
        UNKNOWN_CREDENTIAL("unknown credential"),
        EXPIRED("expired"),
        NOT_YET_VALID("not yet valid"),
        INVALID_SIGNATURE("invalid signature"),
        ALGORITHM_MISMATCH("algorithm mismatch"),
        MALFORMED_TOKEN("malformed token"),
        INVALID_CLAIMS("invalid claims"),
        AUTHENTICATOR_ERROR("authenticator error");

        private final String detail;

        Reason(String detail) {
            this.detail = detail;
        }

        public String detail() {
            return detail;
        }
    }

    private final Reason reason;
    private final String scheme;

    public AuthenticationException(Reason reason) {
        this(reason, null, null);
    }

    public AuthenticationException(Reason reason, String scheme) {
        this(reason, scheme, null);
    }

    public AuthenticationException(Reason reason, String scheme, Throwable cause) {
        super(GENERIC_MESSAGE, cause);
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        this.reason = reason;
        this.scheme = scheme;
    }

    public Reason reason() {
        return reason;
    }

    /** Internal detail recorded in the audit trail (e.g., "expired"). */
    public String detail() {
        return reason.detail();
    }

    /** Scheme the caller attempted, or {@code null} when it could not be determined. */
    public String scheme() {
        return scheme;
    }

    /** Same failure, tagged with the scheme that produced it. */
    public AuthenticationException withScheme(String attemptedScheme) {
        return new AuthenticationException(reason, attemptedScheme, getCause());
    }
}
