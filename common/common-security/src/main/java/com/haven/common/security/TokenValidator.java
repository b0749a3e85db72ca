package com.haven.common.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Map;

/**
 * Verifies bearer tokens and produces an {@link Identity}.
 *
 * <h3>Flow</h3>
 * <pre>
 * 1. Decode the unverified JOSE header → kid, alg
 * 2. kid present → key from {@link PublicKeySet} (refresh on miss / TTL expiry)
 *    kid absent  → shared HMAC secret, only when explicitly allowed
 * 3. Verify signature (+ issuer and audience on the key-set path)
 * 4. exp in the future, iat not beyond the clock-skew tolerance, sub present
 * </pre>
 *
 * Every failure surfaces as {@link InvalidTokenException} with the same generic message;
 * the concrete reason is only logged at DEBUG.
 */
@Slf4j
public class TokenValidator {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final PublicKeySet publicKeySet;
    private final SecurityProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TokenValidator(PublicKeySet publicKeySet, SecurityProperties properties,
                          ObjectMapper objectMapper, Clock clock) {
        this.publicKeySet = publicKeySet;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<Identity> validate(String token) {
        return Mono.defer(() -> {
                    if (token == null || token.isBlank()) {
                        return Mono.error(new InvalidTokenException("Missing token"));
                    }
                    TokenHeader header = decodeHeader(token);
                    if (header.kid() != null) {
                        return publicKeySet.getKey(header.kid())
                                .map(key -> verify(token, key, true));
                    }
                    return Mono.fromCallable(() -> verify(token, sharedSecret(header), false));
                })
                .onErrorMap(e -> !(e instanceof InvalidTokenException),
                        e -> new InvalidTokenException("Unexpected validation failure", e))
                .doOnError(InvalidTokenException.class,
                        e -> log.debug("Token rejected: reason={}", e.getReason()));
    }

    private TokenHeader decodeHeader(String token) {
        int firstDot = token.indexOf('.');
        if (firstDot <= 0) {
            throw new InvalidTokenException("Malformed token");
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.substring(0, firstDot));
            JsonNode header = objectMapper.readTree(json);
            return new TokenHeader(text(header, "kid"), text(header, "alg"));
        } catch (Exception e) {
            throw new InvalidTokenException("Unreadable token header", e);
        }
    }

    private Key sharedSecret(TokenHeader header) {
        if (!properties.allowSharedSecret() || properties.sharedSecret() == null) {
            throw new InvalidTokenException("Token has no key id and shared-secret verification is disabled");
        }
        if (header.alg() == null || !header.alg().startsWith("HS")) {
            throw new InvalidTokenException("Unexpected algorithm without key id: " + header.alg());
        }
        return new SecretKeySpec(properties.sharedSecret().getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
    }

    private Identity verify(String token, Key key, boolean viaKeySet) {
        JwtParserBuilder builder = Jwts.parser()
                .clock(() -> Date.from(clock.instant()));
        if (key instanceof PublicKey publicKey) {
            builder.verifyWith(publicKey);
        } else if (key instanceof SecretKey secretKey) {
            builder.verifyWith(secretKey);
        } else {
            throw new InvalidTokenException("Unsupported key type: " + key.getAlgorithm());
        }
        if (viaKeySet) {
            builder.requireIssuer(properties.resolvedIssuer())
                    .requireAudience(properties.audience());
        }

        Claims claims;
        try {
            claims = builder.build().parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        return toIdentity(claims);
    }

    private Identity toIdentity(Claims claims) {
        Instant now = clock.instant();
        Date expiration = claims.getExpiration();
        if (expiration == null || !expiration.toInstant().isAfter(now)) {
            throw new InvalidTokenException("Token expired or without expiry");
        }
        Date issuedAt = claims.getIssuedAt();
        if (issuedAt != null && issuedAt.toInstant().isAfter(now.plus(properties.clockSkew()))) {
            throw new InvalidTokenException("Token issued in the future");
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Token has no subject");
        }

        Map<?, ?> appMetadata = claims.get("app_metadata", Map.class);
        Map<?, ?> userMetadata = claims.get("user_metadata", Map.class);
        String role = firstNonBlank(stringOf(appMetadata, "role"), claims.get("role", String.class));

        return new Identity(
                subject,
                claims.get("email", String.class),
                role != null ? role : Identity.DEFAULT_ROLE,
                stringOf(userMetadata, "display_name"),
                stringOf(userMetadata, "avatar_url"),
                issuedAt != null ? issuedAt.toInstant() : null,
                expiration.toInstant());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String stringOf(Map<?, ?> map, String key) {
        if (map == null) {
            return null;
        }
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }

    private record TokenHeader(String kid, String alg) {
    }
}
