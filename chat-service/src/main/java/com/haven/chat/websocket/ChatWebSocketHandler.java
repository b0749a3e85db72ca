package com.haven.chat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.protocol.ErrorCodes;
import com.haven.chat.protocol.OutboundFrame;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binds a WebSocket session to a {@link ChatConnection} and the {@link ChatGateway}.
 *
 * <pre>
 * inbound:  authenticate → receive() → concatMap(handleFrame)   (strictly sequential)
 * outbound: connection sink → send()                            (completes on disconnect)
 * </pre>
 * A refused handshake flushes its error frame, then closes with 1008 (policy violation).
 */
@Slf4j
@Component
public class ChatWebSocketHandler implements WebSocketHandler {

    private static final String ENCODING_FAILED_FRAME =
            "{\"event\":\"error\",\"data\":{\"code\":\"" + ErrorCodes.INTERNAL_ERROR + "\",\"message\":\"Internal error\"}}";

    private final ChatGateway chatGateway;
    private final HandshakeTokenExtractor tokenExtractor;
    private final ObjectMapper objectMapper;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public ChatWebSocketHandler(ChatGateway chatGateway, HandshakeTokenExtractor tokenExtractor,
                                ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.chatGateway = chatGateway;
        this.tokenExtractor = tokenExtractor;
        this.objectMapper = objectMapper;
        Gauge.builder("chat.connections.active", activeConnections, AtomicInteger::get)
                .description("Open chat WebSocket connections on this instance")
                .register(meterRegistry);
    }

    /**
     * Lets browsers pass the token as {@code Sec-WebSocket-Protocol: access_token, <jwt>};
     * the handshake then answers with {@code access_token}.
     */
    @Override
    public List<String> getSubProtocols() {
        return List.of(HandshakeTokenExtractor.TOKEN_SUBPROTOCOL);
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        ChatConnection connection = new ChatConnection(session.getId());
        activeConnections.incrementAndGet();

        Mono<Void> outbound = session.send(connection.outbound().map(frame -> session.textMessage(encode(frame))))
                .then(Mono.defer(() -> connection.isRejected()
                        ? session.close(CloseStatus.POLICY_VIOLATION)
                        : Mono.<Void>empty()));

        Mono<Void> inbound = chatGateway.authenticate(connection, tokenExtractor.extract(session.getHandshakeInfo()))
                .flatMap(accepted -> accepted
                        ? session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .concatMap(text -> chatGateway.handleFrame(connection, text))
                                .then()
                        : Mono.<Void>empty())
                .doFinally(signal -> {
                    chatGateway.disconnect(connection);
                    activeConnections.decrementAndGet();
                });

        return Mono.when(inbound, outbound);
    }

    int activeConnections() {
        return activeConnections.get();
    }

    private String encode(OutboundFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Chat frame not serializable: event={}", frame.event(), e);
            return ENCODING_FAILED_FRAME;
        }
    }
}
