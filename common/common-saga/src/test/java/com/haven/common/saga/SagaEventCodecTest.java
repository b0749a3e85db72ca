package com.haven.common.saga;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.SagaStep;
import com.haven.common.event.UserDeletionFailedPayload;
import com.haven.common.event.UserScopedPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SagaEventCodecTest {

    private final SagaEventCodec codec = new SagaEventCodec(new ObjectMapper().findAndRegisterModules());

    @Test
    @DisplayName("Wire format uses the topic as eventType and binds the payload to its record")
    void decode_bindsTypedPayload() {
        String json = """
                {
                  "eventId": "4f0c2d9e-0000-4000-8000-000000000001",
                  "eventType": "user.deletion_failed",
                  "payload": {"userId": "user-9", "failedStep": "chat", "reason": "timeout", "originalEventId": "e-0"},
                  "metadata": {"correlationId": "corr-9", "sourceService": "chat-service", "retryCount": 0, "schemaVersion": "1.0.0"},
                  "emittedAt": "2026-03-01T10:00:00Z"
                }
                """;

        SagaEvent<UserScopedPayload> event = codec.decode(json);

        assertThat(event.eventType()).isEqualTo(SagaEventType.USER_DELETION_FAILED);
        assertThat(event.payload()).isInstanceOf(UserDeletionFailedPayload.class);
        assertThat(((UserDeletionFailedPayload) event.payload()).failedStep()).isEqualTo(SagaStep.CHAT);
        assertThat(event.correlationId()).isEqualTo("corr-9");
        assertThat(event.userId()).isEqualTo("user-9");
    }

    @Test
    @DisplayName("Encoded events carry the topic name and lower-case step")
    void encode_usesWireNames() {
        SagaEvent<UserDeletionFailedPayload> event = SagaEvent.create(SagaEventType.USER_DELETION_FAILED,
                new UserDeletionFailedPayload("user-9", SagaStep.COMMUNITY, "db", "e-0"), "community-service", null);

        String json = codec.encode(event);

        assertThat(json).contains("\"eventType\":\"user.deletion_failed\"")
                .contains("\"failedStep\":\"community\"")
                .contains("\"schemaVersion\":\"1.0.0\"");
        assertThat(codec.decode(json).eventId()).isEqualTo(event.eventId());
    }

    @Test
    @DisplayName("Missing eventId or payload is rejected as non-retryable")
    void decode_incompleteEnvelope_rejected() {
        assertThatThrownBy(() -> codec.decode("{\"eventType\":\"user.deleted\",\"payload\":{\"userId\":\"u\"}}"))
                .isInstanceOf(NonRetryableSagaException.class);
        assertThatThrownBy(() -> codec.decode("{\"eventId\":\"e\",\"eventType\":\"user.deleted\"}"))
                .isInstanceOf(NonRetryableSagaException.class);
        assertThatThrownBy(() -> codec.decode("[]"))
                .isInstanceOf(NonRetryableSagaException.class);
    }
}
