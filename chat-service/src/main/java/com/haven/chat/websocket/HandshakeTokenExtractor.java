package com.haven.chat.websocket;

import com.haven.common.security.BearerTokens;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Finds the bearer token of a WebSocket handshake.
 *
 * <pre>
 * 1. query parameter      ?token=&lt;jwt&gt;
 * 2. subprotocol pair     Sec-WebSocket-Protocol: access_token, &lt;jwt&gt;
 * 3. Authorization header Bearer &lt;jwt&gt;
 * </pre>
 * Browsers cannot set headers on a WebSocket, hence the first two forms.
 */
@Component
public class HandshakeTokenExtractor {

    static final String TOKEN_QUERY_PARAM = "token";
    static final String TOKEN_SUBPROTOCOL = "access_token";
    static final String SEC_WEBSOCKET_PROTOCOL = "Sec-WebSocket-Protocol";

    public Optional<String> extract(HandshakeInfo handshakeInfo) {
        return extract(handshakeInfo.getUri(), handshakeInfo.getHeaders());
    }

    public Optional<String> extract(URI uri, HttpHeaders headers) {
        String fromQuery = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(TOKEN_QUERY_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return Optional.of(fromQuery.trim());
        }
        Optional<String> fromSubprotocol = fromSubprotocols(headers.getOrEmpty(SEC_WEBSOCKET_PROTOCOL));
        if (fromSubprotocol.isPresent()) {
            return fromSubprotocol;
        }
        return Optional.ofNullable(BearerTokens.resolve(headers.getFirst(HttpHeaders.AUTHORIZATION)));
    }

    private Optional<String> fromSubprotocols(List<String> headerValues) {
        List<String> entries = headerValues.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
        int marker = entries.indexOf(TOKEN_SUBPROTOCOL);
        if (marker >= 0 && marker + 1 < entries.size()) {
            return Optional.of(entries.get(marker + 1));
        }
        return Optional.empty();
    }
}
