package com.haven.common.security;

/**
 * Helpers for the {@code Authorization: Bearer <token>} scheme.
 */
public final class BearerTokens {

    private static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * @return the token without the scheme prefix, or {@code null} when the header is absent,
     *         uses another scheme or carries an empty token
     */
    public static String resolve(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return null;
        }
        String token = authorizationHeader.substring(PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
