package com.warden.security;

/**
 * Parses the {@code Authorization} header into a scheme and a credential.
 *
 * @param scheme     canonical scheme name ("key" or "token")
 * @param credential the raw credential
 */
public record AuthorizationHeader(String scheme, String credential) {

    public static final String HEADER_NAME = "Authorization";

    /** Unsupported scheme tokens are cut to this length before they reach logs or audit. */
    public static final int MAX_REPORTED_SCHEME_LENGTH = 32;

    /**
     * Expects {@code "<scheme-token> <credential>"} with exactly two non-empty parts. Scheme
     * tokens are matched ignoring case.
     *
     * @throws AuthenticationException with reason {@code MISSING_HEADER}, {@code MALFORMED_HEADER}
     *                                 or {@code UNSUPPORTED_SCHEME}
     */
    public static AuthorizationHeader parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new AuthenticationException(AuthenticationException.Reason.MISSING_HEADER);
        }
        String[] parts = headerValue.strip().split("\\s+");
        if (parts.length != 2) {
            throw new AuthenticationException(AuthenticationException.Reason.MALFORMED_HEADER);
        }
        AuthScheme scheme = AuthScheme.fromHeaderToken(parts[0])
                .orElseThrow(() -> new AuthenticationException(
                        AuthenticationException.Reason.UNSUPPORTED_SCHEME, truncate(parts[0])));
        return new AuthorizationHeader(scheme.value(), parts[1]);
    }

    private static String truncate(String token) {
        return token.length() <= MAX_REPORTED_SCHEME_LENGTH
                ? token
                : token.substring(0, MAX_REPORTED_SCHEME_LENGTH);
    }
}
