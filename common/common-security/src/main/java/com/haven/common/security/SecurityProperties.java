package com.haven.common.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Token validation settings ({@code haven.security.jwt.*}).
 *
 * @param providerUrl       base URL of the identity provider; issuer and JWKS URI derive from it
 * @param issuer            expected {@code iss}; defaults to {@code {providerUrl}/auth/v1}
 * @param audience          expected {@code aud}
 * @param jwksUri           key set location; defaults to {@code {providerUrl}/auth/v1/.well-known/jwks.json}
 * @param jwksTtl           how long a fetched key set is trusted before a refresh
 * @param jwksTimeout       bound on a single key set fetch
 * @param clockSkew         how far in the future {@code iat} may be
 * @param allowSharedSecret accept HMAC tokens without {@code kid}; local development only
 * @param sharedSecret      HMAC secret for that path
 */
@ConfigurationProperties(prefix = "haven.security.jwt")
public record SecurityProperties(
        String providerUrl,
        String issuer,
        @DefaultValue("authenticated") String audience,
        String jwksUri,
        @DefaultValue("1h") Duration jwksTtl,
        @DefaultValue("5s") Duration jwksTimeout,
        @DefaultValue("60s") Duration clockSkew,
        @DefaultValue("false") boolean allowSharedSecret,
        String sharedSecret
) {

    public String resolvedIssuer() {
        return issuer != null && !issuer.isBlank() ? issuer : providerUrl + "/auth/v1";
    }

    public String resolvedJwksUri() {
        return jwksUri != null && !jwksUri.isBlank()
                ? jwksUri
                : providerUrl + "/auth/v1/.well-known/jwks.json";
    }
}
