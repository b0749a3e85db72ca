package com.haven.gateway.filter;

import com.haven.common.security.BearerTokens;
import com.haven.common.security.Identity;
import com.haven.common.security.TokenValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Edge authentication for every request reaching the gateway.
 *
 * <p>Runs as a WebFlux {@link WebFilter} rather than a gateway {@code GlobalFilter} so it also
 * guards this service's own controllers ({@code /dashboard}). Public paths pass through; all
 * others need a bearer token accepted by {@link TokenValidator}, otherwise the request ends
 * with a generic 401.</p>
 *
 * <h3>Downstream propagation</h3>
 * <pre>
 *   X-User-Id     ← Identity.subjectId
 *   X-User-Email  ← Identity.email
 *   X-User-Role   ← Identity.role
 *   exchange attribute "haven.identity" ← Identity
 * </pre>
 * Client-supplied {@code X-User-*} headers are always removed first so they cannot be forged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter implements WebFilter, Ordered {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_EMAIL_HEADER = "X-User-Email";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String IDENTITY_ATTRIBUTE = "haven.identity";

    private static final List<String> SKIP_PATHS = List.of(
            "/health", "/actuator", "/fallback", "/circuits/status", "/ws");

    private static final byte[] UNAUTHORIZED_BODY =
            "{\"success\":false,\"message\":\"Unauthorized\"}".getBytes(StandardCharsets.UTF_8);

    private final TokenValidator tokenValidator;

    /** Public prefixes match whole path segments only: {@code /ws/chat} yes, {@code /wsx} no. */
    static boolean isPublic(String path) {
        return SKIP_PATHS.stream().anyMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getURI().getPath();
        ServerWebExchange sanitized = stripIdentityHeaders(exchange);

        if (isPublic(path)) {
            return chain.filter(sanitized);
        }

        String token = BearerTokens.resolve(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            log.debug("Missing bearer token: path={}", path);
            return unauthorized(exchange);
        }

        return tokenValidator.validate(token)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("JWT validation failed: path={}", path);
                    return Mono.just(Optional.empty());
                })
                .flatMap(identity -> identity
                        .map(value -> chain.filter(authenticated(sanitized, value)))
                        .orElseGet(() -> unauthorized(exchange)));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    private ServerWebExchange authenticated(ServerWebExchange exchange, Identity identity) {
        log.debug("JWT authenticated: userId={}, path={}", identity.subjectId(), exchange.getRequest().getURI().getPath());
        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .headers(headers -> {
                    headers.set(USER_ID_HEADER, identity.subjectId());
                    if (identity.email() != null) {
                        headers.set(USER_EMAIL_HEADER, identity.email());
                    }
                    headers.set(USER_ROLE_HEADER, identity.role());
                })
                .build();
        ServerWebExchange mutated = exchange.mutate().request(mutatedRequest).build();
        mutated.getAttributes().put(IDENTITY_ATTRIBUTE, identity);
        return mutated;
    }

    private ServerWebExchange stripIdentityHeaders(ServerWebExchange exchange) {
        HttpHeaders incoming = exchange.getRequest().getHeaders();
        if (!incoming.containsKey(USER_ID_HEADER) && !incoming.containsKey(USER_EMAIL_HEADER)
                && !incoming.containsKey(USER_ROLE_HEADER)) {
            return exchange;
        }
        ServerHttpRequest stripped = exchange.getRequest().mutate()
                .headers(headers -> {
                    headers.remove(USER_ID_HEADER);
                    headers.remove(USER_EMAIL_HEADER);
                    headers.remove(USER_ROLE_HEADER);
                })
                .build();
        return exchange.mutate().request(stripped).build();
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer body = response.bufferFactory().wrap(UNAUTHORIZED_BODY);
        return response.writeWith(Mono.just(body));
    }
}
