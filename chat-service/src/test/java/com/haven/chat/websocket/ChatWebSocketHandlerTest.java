package com.haven.chat.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.backplane.RedisBackplane;
import com.haven.chat.config.ChatProperties;
import com.haven.chat.protocol.ErrorCodes;
import com.haven.chat.service.ChatService;
import com.haven.common.security.Identity;
import com.haven.common.security.TokenValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Publisher;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ChatWebSocketHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private TokenValidator tokenValidator;
    @Mock
    private ChatService chatService;
    @Mock
    private RedisBackplane backplane;
    @Mock
    private RoomPresence roomPresence;
    @Mock
    private WebSocketSession session;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final MeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<String> sent = new ArrayList<>();
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        RoomRegistry roomRegistry = new RoomRegistry();
        ChatProperties properties = ChatProperties.defaults();
        ChatGateway gateway = new ChatGateway(tokenValidator, roomRegistry, roomPresence,
                new RoomBroadcaster(roomRegistry, backplane), new ConfigurableRoomAccessPolicy(properties),
                chatService, properties, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        handler = new ChatWebSocketHandler(gateway, new HandshakeTokenExtractor(), objectMapper, meterRegistry);

        given(session.getId()).willReturn("c-1");
        given(session.textMessage(anyString())).willAnswer(inv -> text(inv.getArgument(0)));
        given(session.send(any())).willAnswer(inv -> {
            Publisher<WebSocketMessage> frames = inv.getArgument(0);
            return Flux.from(frames).doOnNext(frame -> sent.add(frame.getPayloadAsText())).then();
        });
        lenient().when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());
    }

    private static WebSocketMessage text(String payload) {
        return new WebSocketMessage(WebSocketMessage.Type.TEXT,
                DefaultDataBufferFactory.sharedInstance.wrap(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private void handshake(String uri) {
        given(session.getHandshakeInfo()).willReturn(
                new HandshakeInfo(URI.create(uri), new HttpHeaders(), Mono.empty(), null));
    }

    private double activeConnections() {
        return meterRegistry.get("chat.connections.active").gauge().value();
    }

    private JsonNode frame(int index) throws Exception {
        return objectMapper.readTree(sent.get(index));
    }

    @Test
    @DisplayName("Handshake without a token flushes AUTH_REQUIRED, then closes with policy violation")
    void noToken_errorThenPolicyViolation() throws Exception {
        handshake("ws://localhost/ws/chat");

        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(sent).hasSize(1);
        assertThat(frame(0).get("event").asText()).isEqualTo("error");
        assertThat(frame(0).get("data").get("code").asText()).isEqualTo(ErrorCodes.AUTH_REQUIRED);
        InOrder order = inOrder(session);
        order.verify(session).send(any());
        order.verify(session).close(CloseStatus.POLICY_VIOLATION);
        verify(session, never()).receive();
        assertThat(activeConnections()).isZero();
    }

    @Test
    @DisplayName("Rejected token is answered with AUTH_FAILED and the socket is closed")
    void invalidToken_errorThenPolicyViolation() throws Exception {
        handshake("ws://localhost/ws/chat?token=forged");
        given(tokenValidator.validate("forged")).willReturn(Mono.error(new IllegalStateException("bad signature")));

        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(frame(0).get("data").get("code").asText()).isEqualTo(ErrorCodes.AUTH_FAILED);
        assertThat(frame(0).get("data").get("message").asText()).isEqualTo("Invalid token");
        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verify(session, never()).receive();
        assertThat(activeConnections()).isZero();
    }

    @Test
    @DisplayName("Authenticated session exchanges frames and is released when the client goes away")
    void authenticated_framesThenRelease() throws Exception {
        handshake("ws://localhost/ws/chat?token=good");
        given(tokenValidator.validate("good")).willReturn(Mono.just(new Identity("user-a", "a@haven.test",
                "user", "Ada", null, NOW, NOW.plusSeconds(3600))));
        given(chatService.getRecentMessages(anyString(), anyInt())).willReturn(Mono.just(List.of()));
        given(session.receive()).willReturn(Flux.just(text("{\"event\":\"join_room\",\"data\":{\"roomId\":\"general\"}}")));

        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(sent).hasSize(2);
        assertThat(frame(0).get("event").asText()).isEqualTo("connected");
        assertThat(frame(1).get("event").asText()).isEqualTo("chat_history");
        verify(session, never()).close(any(CloseStatus.class));
        verify(roomPresence).unregister(eq("general"), any(ChatConnection.class));
        assertThat(activeConnections()).isZero();
    }
}
