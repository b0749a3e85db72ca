package com.haven.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.common.event.SagaEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes saga events into the outbox table.
 *
 * <p>Must join the caller's transaction: the state change and the event commit or roll back
 * together. Calling it without one is a programming error and fails fast.</p>
 *
 * <pre>
 *   &#64;Transactional
 *   public void requestDeletion(String userId) {
 *       profile.markDeleted(now);                       // 1. business state
 *       outboxService.saveEvent("Profile", event);      // 2. event, same commit
 *   }
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, SagaEvent<?> event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            OutboxEvent outboxEvent = OutboxEvent.builder()
                    .aggregateType(aggregateType)
                    .aggregateId(event.userId())
                    .eventId(event.eventId())
                    .eventType(event.eventType().getTopic())
                    .payload(payload)
                    .build();
            OutboxEvent saved = outboxEventRepository.save(outboxEvent);
            log.debug("Outbox event saved: type={}, eventId={}, aggregateId={}",
                    outboxEvent.getEventType(), event.eventId(), event.userId());
            return saved;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox event: type={}, eventId={}",
                    event.eventType(), event.eventId(), e);
            throw new IllegalStateException("Failed to serialize outbox event", e);
        }
    }
}
