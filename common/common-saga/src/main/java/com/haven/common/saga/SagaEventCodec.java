package com.haven.common.saga;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.SagaMetadata;
import com.haven.common.event.UserScopedPayload;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * JSON (de)serialization of saga envelopes.
 * Decoding resolves {@code eventType} first and binds {@code payload} to that type's record.
 */
@RequiredArgsConstructor
public class SagaEventCodec {

    private final ObjectMapper objectMapper;

    public String encode(SagaEvent<?> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new SagaPublishException("Failed to serialize saga event " + event.eventId(), e);
        }
    }

    public SagaEvent<UserScopedPayload> decode(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new NonRetryableSagaException("Saga message is not a JSON object");
            }
            String eventId = root.path("eventId").asText(null);
            if (eventId == null || eventId.isBlank()) {
                throw new NonRetryableSagaException("Saga message has no eventId");
            }
            String typeName = root.path("eventType").asText(null);
            SagaEventType type = SagaEventType.fromTopic(typeName)
                    .orElseThrow(() -> new NonRetryableSagaException("Unknown saga event type: " + typeName));
            JsonNode payloadNode = root.get("payload");
            if (payloadNode == null || payloadNode.isNull()) {
                throw new NonRetryableSagaException("Saga message has no payload: eventId=" + eventId);
            }

            UserScopedPayload payload = objectMapper.treeToValue(payloadNode, type.getPayloadType());
            SagaMetadata metadata = root.hasNonNull("metadata")
                    ? objectMapper.treeToValue(root.get("metadata"), SagaMetadata.class)
                    : null;
            Instant emittedAt = root.hasNonNull("emittedAt")
                    ? objectMapper.treeToValue(root.get("emittedAt"), Instant.class)
                    : null;
            return new SagaEvent<>(eventId, type, payload, metadata, emittedAt);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new NonRetryableSagaException("Unreadable saga message: " + e.getMessage(), e);
        }
    }
}
