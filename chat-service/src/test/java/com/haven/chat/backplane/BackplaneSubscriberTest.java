package com.haven.chat.backplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.config.ChatProperties;
import com.haven.chat.protocol.OutboundFrame;
import com.haven.chat.websocket.RoomBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.DefaultMessage;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BackplaneSubscriberTest {

    @Mock
    private RoomBroadcaster broadcaster;

    private BackplaneSubscriber subscriber;

    @BeforeEach
    void setUp() {
        ChatProperties properties = new ChatProperties(50, 5000, Duration.ofSeconds(5), Duration.ofSeconds(3),
                "chat:broadcast", "instance-1", Set.of());
        subscriber = new BackplaneSubscriber(broadcaster, new ObjectMapper(), properties);
    }

    private static DefaultMessage message(String body) {
        return new DefaultMessage("chat:broadcast".getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Envelope from another instance reaches every local occupant, its exclusion is origin-local")
    void foreignEnvelope_deliveredLocally() {
        subscriber.onMessage(message("{\"originInstanceId\":\"instance-2\",\"roomId\":\"general\","
                + "\"excludeConnectionId\":\"c-7\",\"event\":\"user_typing\","
                + "\"data\":{\"userId\":\"user-b\",\"isTyping\":true}}"), null);

        ArgumentCaptor<OutboundFrame> frame = ArgumentCaptor.forClass(OutboundFrame.class);
        verify(broadcaster).deliverLocal(eq("general"), frame.capture(), isNull());
        assertThat(frame.getValue().event()).isEqualTo("user_typing");
    }

    @Test
    @DisplayName("Own envelopes are ignored, they were already delivered locally")
    void ownEnvelope_ignored() {
        subscriber.onMessage(message("{\"originInstanceId\":\"instance-1\",\"roomId\":\"general\","
                + "\"event\":\"receive_message\",\"data\":{}}"), null);

        verify(broadcaster, never()).deliverLocal(anyString(), any(), any());
    }

    @Test
    @DisplayName("Unreadable payload is dropped without throwing")
    void malformed_dropped() {
        subscriber.onMessage(message("not json"), null);
        subscriber.onMessage(message("null"), null);

        verify(broadcaster, never()).deliverLocal(anyString(), any(), any());
    }
}
