package com.haven.gateway.filter;

import com.haven.common.security.Identity;
import com.haven.common.security.InvalidTokenException;
import com.haven.common.security.TokenValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class JwtAuthFilterTest {

    @Mock
    private TokenValidator tokenValidator;

    @InjectMocks
    private JwtAuthFilter filter;

    private final AtomicReference<ServerWebExchange> forwarded = new AtomicReference<>();
    private final WebFilterChain chain = exchange -> {
        forwarded.set(exchange);
        return Mono.empty();
    };

    private final Identity identity = new Identity("user-42", "ada@haven.test", "moderator", "Ada", null,
            Instant.now(), Instant.now().plusSeconds(3600));

    @Test
    @DisplayName("Valid token: identity headers and exchange attribute reach the downstream chain")
    void validToken_propagatesIdentity() {
        given(tokenValidator.validate("good-token")).willReturn(Mono.just(identity));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/dashboard")
                .header(HttpHeaders.AUTHORIZATION, "Bearer good-token"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        HttpHeaders headers = forwarded.get().getRequest().getHeaders();
        assertThat(headers.getFirst(JwtAuthFilter.USER_ID_HEADER)).isEqualTo("user-42");
        assertThat(headers.getFirst(JwtAuthFilter.USER_EMAIL_HEADER)).isEqualTo("ada@haven.test");
        assertThat(headers.getFirst(JwtAuthFilter.USER_ROLE_HEADER)).isEqualTo("moderator");
        assertThat((Object) forwarded.get().getAttribute(JwtAuthFilter.IDENTITY_ATTRIBUTE)).isEqualTo(identity);
    }

    @Test
    @DisplayName("Missing token: 401 with the generic JSON body and no downstream call")
    void missingToken_unauthorized() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/posts"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exchange.getResponse().getBodyAsString().block())
                .isEqualTo("{\"success\":false,\"message\":\"Unauthorized\"}");
        assertThat(forwarded.get()).isNull();
        verify(tokenValidator, never()).validate(anyString());
    }

    @Test
    @DisplayName("Rejected token: 401 regardless of the rejection reason")
    void rejectedToken_unauthorized() {
        given(tokenValidator.validate("expired-token")).willReturn(Mono.error(new InvalidTokenException("expired")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/profiles/me")
                .header(HttpHeaders.AUTHORIZATION, "Bearer expired-token"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(forwarded.get()).isNull();
    }

    @Test
    @DisplayName("Public paths pass without a token but forged identity headers are removed")
    void publicPath_passesAndStripsForgedHeaders() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/circuits/status")
                .header(JwtAuthFilter.USER_ID_HEADER, "someone-else"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(forwarded.get()).isNotNull();
        assertThat(forwarded.get().getRequest().getHeaders().containsKey(JwtAuthFilter.USER_ID_HEADER)).isFalse();
        verify(tokenValidator, never()).validate(anyString());
    }

    @Test
    @DisplayName("Lookalike paths of public prefixes still need a token")
    void lookalikePublicPath_unauthorized() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/wsx/admin"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(forwarded.get()).isNull();
    }

    @Test
    @DisplayName("Public prefixes match whole path segments")
    void publicPathMatching() {
        assertThat(JwtAuthFilter.isPublic("/health")).isTrue();
        assertThat(JwtAuthFilter.isPublic("/health/ready")).isTrue();
        assertThat(JwtAuthFilter.isPublic("/ws/chat")).isTrue();
        assertThat(JwtAuthFilter.isPublic("/healthz")).isFalse();
        assertThat(JwtAuthFilter.isPublic("/wsx")).isFalse();
        assertThat(JwtAuthFilter.isPublic("/fallbackFoo")).isFalse();
        assertThat(JwtAuthFilter.isPublic("/dashboard")).isFalse();
    }

    @Test
    @DisplayName("Downstream errors after authentication are not turned into a 401")
    void downstreamError_propagates() {
        given(tokenValidator.validate("good-token")).willReturn(Mono.just(identity));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/dashboard")
                .header(HttpHeaders.AUTHORIZATION, "Bearer good-token"));
        WebFilterChain failing = e -> Mono.error(new IllegalStateException("boom"));

        StepVerifier.create(filter.filter(exchange, failing))
                .expectError(IllegalStateException.class)
                .verify();
        assertThat(exchange.getResponse().getStatusCode()).isNotEqualTo(HttpStatus.UNAUTHORIZED);
    }
}
