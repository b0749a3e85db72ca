package com.haven.chat.backplane;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A room broadcast relayed between instances over Redis pub/sub.
 *
 * @param originInstanceId    instance that produced the broadcast; it ignores its own envelopes
 * @param roomId              target room
 * @param excludeConnectionId connection on the origin instance left out of the broadcast, or {@code null};
 *                            other instances deliver to all their occupants
 * @param event               server event name
 * @param data                event body as already sent locally
 */
public record BackplaneEnvelope(
        String originInstanceId,
        String roomId,
        String excludeConnectionId,
        String event,
        JsonNode data
) {
}
