package com.haven.chat.websocket;

import com.haven.chat.protocol.OutboundFrame;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Server-side state of one socket plus its outbound queue.
 *
 * <p>Frames for a connection may be produced by its own inbound pipeline, by other
 * connections' broadcasts and by the backplane listener, so {@link #send} is serialized.
 * Nothing is queued once the connection is {@link ConnectionState#DISCONNECTED}.</p>
 */
@Slf4j
@Getter
public class ChatConnection {

    private final String connectionId;
    @Getter(AccessLevel.NONE)
    private final Sinks.Many<OutboundFrame> outbound = Sinks.many().unicast().onBackpressureBuffer();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile String userId;
    private volatile String username;
    private volatile String currentRoom;
    private volatile boolean rejected;

    public ChatConnection(String connectionId) {
        this.connectionId = connectionId;
    }

    public Flux<OutboundFrame> outbound() {
        return outbound.asFlux();
    }

    public synchronized void send(OutboundFrame frame) {
        if (state == ConnectionState.DISCONNECTED) {
            log.debug("Dropping frame for closed connection: connectionId={}, event={}", connectionId, frame.event());
            return;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isFailure()) {
            log.warn("Frame not queued: connectionId={}, event={}, result={}", connectionId, frame.event(), result);
        }
    }

    public void beginAuthentication() {
        state = ConnectionState.AUTHENTICATING;
    }

    public void authenticate(String userId, String username) {
        this.userId = userId;
        this.username = username;
        this.state = ConnectionState.AUTHENTICATED;
    }

    /**
     * Marks the handshake as refused; the socket is closed with a policy-violation status
     * once the queued error frame is flushed.
     */
    public void reject() {
        this.rejected = true;
    }

    public void enterRoom(String roomId) {
        this.currentRoom = roomId;
        this.state = ConnectionState.IN_ROOM;
    }

    public void leaveRoom() {
        this.currentRoom = null;
        this.state = ConnectionState.AUTHENTICATED;
    }

    public boolean isAuthenticated() {
        ConnectionState current = state;
        return current == ConnectionState.AUTHENTICATED || current == ConnectionState.IN_ROOM;
    }

    public boolean isInRoom(String roomId) {
        return roomId != null && roomId.equals(currentRoom);
    }

    /**
     * @return {@code false} if the connection was already closed
     */
    public synchronized boolean close() {
        if (state == ConnectionState.DISCONNECTED) {
            return false;
        }
        state = ConnectionState.DISCONNECTED;
        outbound.tryEmitComplete();
        return true;
    }
}
