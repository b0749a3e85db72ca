package com.haven.common.security;

import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.security.Key;
import java.util.HashMap;
import java.util.Map;

/**
 * Fetches the provider's JSON Web Key Set over HTTP and parses it with jjwt.
 * Keys without a {@code kid} or of an unsupported type are skipped.
 */
@Slf4j
public class WebClientJwksSource implements JwksSource {

    private final WebClient webClient;
    private final String jwksUri;

    public WebClientJwksSource(WebClient.Builder webClientBuilder, String jwksUri) {
        this.webClient = webClientBuilder.build();
        this.jwksUri = jwksUri;
    }

    @Override
    public Mono<Map<String, Key>> fetchKeys() {
        return webClient.get()
                .uri(jwksUri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .map(WebClientJwksSource::parse)
                .doOnNext(keys -> log.info("JWKS fetched: uri={}, keys={}", jwksUri, keys.keySet()));
    }

    static Map<String, Key> parse(String json) {
        JwkSet jwkSet = Jwks.setParser().build().parse(json);
        Map<String, Key> keys = new HashMap<>();
        for (Jwk<?> jwk : jwkSet.getKeys()) {
            if (jwk.getId() != null) {
                keys.put(jwk.getId(), jwk.toKey());
            }
        }
        return keys;
    }
}
