package com.haven.chat.backplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.config.ChatProperties;
import com.haven.chat.protocol.OutboundFrame;
import com.haven.chat.websocket.RoomBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Receiving side of the backplane: replays other instances' room broadcasts to local connections.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackplaneSubscriber implements MessageListener {

    private final RoomBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final ChatProperties properties;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        BackplaneEnvelope envelope;
        try {
            envelope = objectMapper.readValue(message.getBody(), BackplaneEnvelope.class);
        } catch (IOException e) {
            log.warn("Discarding unreadable backplane message: {}", e.getMessage());
            return;
        }
        if (envelope == null || properties.instanceId().equals(envelope.originInstanceId())) {
            return;
        }
        if (envelope.roomId() == null || envelope.event() == null) {
            log.warn("Discarding incomplete backplane message from instance {}", envelope.originInstanceId());
            return;
        }
        // the excluded connection lives on the origin instance; ids are only unique per instance
        broadcaster.deliverLocal(envelope.roomId(), new OutboundFrame(envelope.event(), envelope.data()), null);
    }
}
