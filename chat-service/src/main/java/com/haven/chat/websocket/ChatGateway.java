package com.haven.chat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.config.ChatProperties;
import com.haven.chat.protocol.*;
import com.haven.chat.service.ChatService;
import com.haven.common.security.TokenValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Protocol logic of the real-time gateway, independent of the transport.
 *
 * <h3>Per connection</h3>
 * <pre>
 * authenticate   token → TokenValidator (bounded by auth-timeout)
 *                  ✓ connected{userId, username}
 *                  ✗ error{AUTH_REQUIRED | AUTH_FAILED}, socket closed
 * handleFrame    one frame at a time, in arrival order
 * disconnect     user_left to the current room, membership dropped
 * </pre>
 *
 * <h3>★ Optimistic delivery</h3>
 * A message is broadcast even when persisting it fails; it then carries a temporary
 * {@code tmp-} id. The sender always gets exactly one {@code message_sent} echoing its
 * {@code clientMessageId}.
 */
@Slf4j
@Component
public class ChatGateway {

    static final String ANONYMOUS = "Anonymous";
    static final String TEMP_ID_PREFIX = "tmp-";

    private final TokenValidator tokenValidator;
    private final RoomRegistry roomRegistry;
    private final RoomPresence roomPresence;
    private final RoomBroadcaster broadcaster;
    private final RoomAccessPolicy accessPolicy;
    private final ChatService chatService;
    private final ChatProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChatGateway(TokenValidator tokenValidator, RoomRegistry roomRegistry, RoomPresence roomPresence,
                       RoomBroadcaster broadcaster, RoomAccessPolicy accessPolicy, ChatService chatService, ChatProperties properties,
                       ObjectMapper objectMapper, Clock clock) {
        this.tokenValidator = tokenValidator;
        this.roomRegistry = roomRegistry;
        this.roomPresence = roomPresence;
        this.broadcaster = broadcaster;
        this.accessPolicy = accessPolicy;
        this.chatService = chatService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return whether the connection may proceed to exchange frames
     */
    public Mono<Boolean> authenticate(ChatConnection connection, Optional<String> token) {
        connection.beginAuthentication();
        if (token.isEmpty()) {
            log.warn("Connection rejected, no token: connectionId={}", connection.getConnectionId());
            return Mono.just(refuse(connection, ErrorCodes.AUTH_REQUIRED, "Authentication token required"));
        }
        return tokenValidator.validate(token.get())
                .timeout(properties.authTimeout())
                .map(identity -> {
                    connection.authenticate(identity.subjectId(), identity.preferredName(ANONYMOUS));
                    connection.send(OutboundFrame.of(ServerEvent.CONNECTED, new ConnectedPayload(
                            connection.getUserId(), connection.getUsername(), "Connection authenticated")));
                    log.info("Connection authenticated: connectionId={}, userId={}",
                            connection.getConnectionId(), connection.getUserId());
                    return true;
                })
                .onErrorResume(e -> {
                    log.warn("Connection rejected, token not accepted: connectionId={}, reason={}",
                            connection.getConnectionId(), e.toString());
                    return Mono.just(refuse(connection, ErrorCodes.AUTH_FAILED, "Invalid token"));
                });
    }

    public Mono<Void> handleFrame(ChatConnection connection, String raw) {
        InboundFrame frame;
        try {
            frame = objectMapper.readValue(raw, InboundFrame.class);
        } catch (JsonProcessingException e) {
            connection.send(OutboundFrame.error(ErrorCodes.VALIDATION_FAILED, "Malformed frame"));
            return Mono.empty();
        }
        if (frame == null || frame.event() == null) {
            connection.send(OutboundFrame.error(ErrorCodes.VALIDATION_FAILED, "Frame has no event"));
            return Mono.empty();
        }
        Optional<ClientEvent> event = ClientEvent.fromWireName(frame.event());
        if (event.isEmpty()) {
            connection.send(OutboundFrame.error(ErrorCodes.UNKNOWN_EVENT, "Unknown event: " + frame.event()));
            return Mono.empty();
        }
        return Mono.defer(() -> dispatch(connection, event.get(), frame.data()))
                .onErrorResume(e -> {
                    log.error("Chat event failed: connectionId={}, event={}",
                            connection.getConnectionId(), frame.event(), e);
                    connection.send(OutboundFrame.error(ErrorCodes.INTERNAL_ERROR, "Internal error"));
                    return Mono.empty();
                });
    }

    public void disconnect(ChatConnection connection) {
        String room = connection.getCurrentRoom();
        if (!connection.close()) {
            return;
        }
        if (room != null) {
            roomRegistry.leave(room, connection);
            roomPresence.unregister(room, connection);
            broadcaster.broadcast(room, OutboundFrame.of(ServerEvent.USER_LEFT,
                    presence(connection, "User disconnected")), connection.getConnectionId());
        }
        log.info("Connection closed: connectionId={}, userId={}", connection.getConnectionId(),
                connection.getUserId() != null ? connection.getUserId() : "unauthenticated");
    }

    private Mono<Void> dispatch(ChatConnection connection, ClientEvent event, JsonNode data) {
        if (!connection.isAuthenticated()) {
            connection.send(OutboundFrame.error(ErrorCodes.NOT_AUTHENTICATED, "Authentication required"));
            return Mono.empty();
        }
        return switch (event) {
            case JOIN_ROOM -> read(connection, data, RoomRequest.class)
                    .map(request -> joinRoom(connection, request)).orElseGet(Mono::empty);
            case LEAVE_ROOM -> read(connection, data, RoomRequest.class)
                    .map(request -> leaveRoom(connection, request)).orElseGet(Mono::empty);
            case SEND_MESSAGE -> read(connection, data, SendMessageRequest.class)
                    .map(request -> sendMessage(connection, request)).orElseGet(Mono::empty);
            case TYPING -> read(connection, data, TypingRequest.class)
                    .map(request -> typing(connection, request)).orElseGet(Mono::empty);
            case GET_ROOM_USERS -> read(connection, data, RoomRequest.class)
                    .map(request -> roomUsers(connection, request)).orElseGet(Mono::empty);
        };
    }

    private Mono<Void> joinRoom(ChatConnection connection, RoomRequest request) {
        String roomId = trimToNull(request.roomId());
        if (roomId == null) {
            return validationFailed(connection, "roomId is required");
        }
        if (!accessPolicy.canAccessRoom(connection.getUserId(), roomId)) {
            log.warn("Room access denied: userId={}, roomId={}", connection.getUserId(), roomId);
            connection.send(OutboundFrame.error(ErrorCodes.ROOM_ACCESS_DENIED, "No access to this room"));
            return Mono.empty();
        }

        // re-joining the current room only replays the history
        if (!connection.isInRoom(roomId)) {
            if (connection.getCurrentRoom() != null) {
                leaveCurrentRoom(connection);
            }
            roomRegistry.join(roomId, connection);
            connection.enterRoom(roomId);
            roomPresence.register(roomId, connection);
            broadcaster.broadcast(roomId, OutboundFrame.of(ServerEvent.USER_JOINED,
                    presence(connection, "User joined the room")), connection.getConnectionId());
            log.info("Room joined: userId={}, roomId={}", connection.getUserId(), roomId);
        }

        return chatService.getRecentMessages(roomId, properties.historyLimit())
                .map(messages -> messages.stream().map(MessagePayload::from).toList())
                .onErrorResume(e -> {
                    log.error("Chat history unavailable: roomId={}, reason={}", roomId, e.toString());
                    return Mono.just(List.of());
                })
                .doOnNext(messages -> connection.send(OutboundFrame.of(ServerEvent.CHAT_HISTORY,
                        new ChatHistoryPayload(roomId, messages))))
                .then();
    }

    private Mono<Void> leaveRoom(ChatConnection connection, RoomRequest request) {
        String roomId = trimToNull(request.roomId());
        if (roomId == null) {
            return validationFailed(connection, "roomId is required");
        }
        if (!connection.isInRoom(roomId)) {
            log.debug("Leave ignored, not in room: connectionId={}, roomId={}", connection.getConnectionId(), roomId);
            return Mono.empty();
        }
        leaveCurrentRoom(connection);
        return Mono.empty();
    }

    private Mono<Void> sendMessage(ChatConnection connection, SendMessageRequest request) {
        String roomId = trimToNull(request.roomId());
        String content = request.message() != null ? request.message().trim() : "";
        if (roomId == null || content.isEmpty()) {
            return validationFailed(connection, "roomId and a non-empty message are required");
        }
        if (content.length() > properties.maxMessageLength()) {
            return validationFailed(connection, "Message exceeds " + properties.maxMessageLength() + " characters");
        }
        if (!connection.isInRoom(roomId)) {
            connection.send(OutboundFrame.error(ErrorCodes.ROOM_ACCESS_DENIED, "Join the room before sending"));
            return Mono.empty();
        }

        String userId = connection.getUserId();
        String username = connection.getUsername();
        String clientMessageId = request.clientMessageId();
        return chatService.saveMessage(userId, username, roomId, content, clientMessageId)
                .map(saved -> String.valueOf(saved.getId()))
                .onErrorResume(e -> {
                    log.warn("Chat message not persisted, delivering with a temporary id: roomId={}, reason={}",
                            roomId, e.toString());
                    return Mono.just(TEMP_ID_PREFIX + UUID.randomUUID());
                })
                .doOnNext(messageId -> {
                    MessagePayload payload = new MessagePayload(messageId, userId, username, content, roomId,
                            clock.instant(), connection.getConnectionId(), clientMessageId);
                    broadcaster.broadcast(roomId, OutboundFrame.of(ServerEvent.RECEIVE_MESSAGE, payload), null);
                    connection.send(OutboundFrame.of(ServerEvent.MESSAGE_SENT,
                            new MessageSentPayload(true, messageId, clientMessageId)));
                })
                .then();
    }

    private Mono<Void> typing(ChatConnection connection, TypingRequest request) {
        String roomId = trimToNull(request.roomId());
        if (roomId == null) {
            return validationFailed(connection, "roomId is required");
        }
        if (!connection.isInRoom(roomId)) {
            connection.send(OutboundFrame.error(ErrorCodes.ROOM_ACCESS_DENIED, "Join the room first"));
            return Mono.empty();
        }
        broadcaster.broadcast(roomId, OutboundFrame.of(ServerEvent.USER_TYPING,
                new TypingPayload(connection.getUserId(), connection.getUsername(), request.typing())),
                connection.getConnectionId());
        return Mono.empty();
    }

    private Mono<Void> roomUsers(ChatConnection connection, RoomRequest request) {
        String roomId = trimToNull(request.roomId());
        if (roomId == null) {
            return validationFailed(connection, "roomId is required");
        }
        return roomPresence.users(roomId)
                .doOnNext(users -> connection.send(OutboundFrame.of(ServerEvent.ROOM_USERS,
                        new RoomUsersPayload(roomId, users))))
                .then();
    }

    private void leaveCurrentRoom(ChatConnection connection) {
        String room = connection.getCurrentRoom();
        roomRegistry.leave(room, connection);
        roomPresence.unregister(room, connection);
        connection.leaveRoom();
        broadcaster.broadcast(room, OutboundFrame.of(ServerEvent.USER_LEFT,
                presence(connection, "User left the room")), connection.getConnectionId());
        log.info("Room left: userId={}, roomId={}", connection.getUserId(), room);
    }

    private boolean refuse(ChatConnection connection, String code, String message) {
        connection.send(OutboundFrame.error(code, message));
        connection.reject();
        return false;
    }

    private PresencePayload presence(ChatConnection connection, String message) {
        return new PresencePayload(connection.getUserId(), connection.getUsername(), message, clock.instant());
    }

    private <T> Optional<T> read(ChatConnection connection, JsonNode data, Class<T> type) {
        try {
            JsonNode body = data != null && data.isObject() ? data : objectMapper.createObjectNode();
            return Optional.of(objectMapper.treeToValue(body, type));
        } catch (JsonProcessingException e) {
            connection.send(OutboundFrame.error(ErrorCodes.VALIDATION_FAILED, "Invalid event data"));
            return Optional.empty();
        }
    }

    private static Mono<Void> validationFailed(ChatConnection connection, String message) {
        connection.send(OutboundFrame.error(ErrorCodes.VALIDATION_FAILED, message));
        return Mono.empty();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
