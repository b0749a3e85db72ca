package com.haven.chat.websocket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeTokenExtractorTest {

    private final HandshakeTokenExtractor extractor = new HandshakeTokenExtractor();

    @Test
    @DisplayName("Query parameter wins over the other sources")
    void queryParameterFirst() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer from-header");

        assertThat(extractor.extract(URI.create("ws://chat/ws/chat?token=from-query"), headers))
                .contains("from-query");
    }

    @Test
    @DisplayName("Subprotocol pair access_token, <jwt> is read before the Authorization header")
    void subprotocolPair() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HandshakeTokenExtractor.SEC_WEBSOCKET_PROTOCOL, "access_token, eyJ.sub.sig");
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer from-header");

        assertThat(extractor.extract(URI.create("ws://chat/ws/chat"), headers)).contains("eyJ.sub.sig");
    }

    @Test
    @DisplayName("Authorization header is the last resort")
    void authorizationHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer from-header");

        assertThat(extractor.extract(URI.create("ws://chat/ws/chat"), headers)).contains("from-header");
    }

    @Test
    @DisplayName("No token anywhere, or a dangling access_token marker, yields nothing")
    void noToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HandshakeTokenExtractor.SEC_WEBSOCKET_PROTOCOL, "access_token");

        assertThat(extractor.extract(URI.create("ws://chat/ws/chat?token="), headers)).isEmpty();
    }
}
