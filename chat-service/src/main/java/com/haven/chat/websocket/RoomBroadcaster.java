package com.haven.chat.websocket;

import com.haven.chat.backplane.RedisBackplane;
import com.haven.chat.protocol.OutboundFrame;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Room fan-out: local connections first, then the backplane for the other instances.
 */
@Component
@RequiredArgsConstructor
public class RoomBroadcaster {

    private final RoomRegistry roomRegistry;
    private final RedisBackplane backplane;

    /**
     * @param excludeConnectionId connection left out, e.g. the sender of a typing indicator; may be {@code null}
     */
    public void broadcast(String roomId, OutboundFrame frame, String excludeConnectionId) {
        deliverLocal(roomId, frame, excludeConnectionId);
        backplane.publish(roomId, frame, excludeConnectionId);
    }

    public void deliverLocal(String roomId, OutboundFrame frame, String excludeConnectionId) {
        for (ChatConnection connection : roomRegistry.occupants(roomId)) {
            if (!connection.getConnectionId().equals(excludeConnectionId)) {
                connection.send(frame);
            }
        }
    }
}
