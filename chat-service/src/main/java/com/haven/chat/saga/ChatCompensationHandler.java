package com.haven.chat.saga;

import com.haven.chat.service.ChatService;
import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.SagaStep;
import com.haven.common.event.UserDeletionFailedPayload;
import com.haven.common.saga.SagaEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Puts anonymized messages back when community-service fails its step.
 * The restore only touches anonymized rows, so a redelivered failure event is harmless
 * and a failed restore is simply retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatCompensationHandler implements SagaEventHandler<UserDeletionFailedPayload> {

    private final ChatService chatService;

    @Override
    public SagaEventType eventType() {
        return SagaEventType.USER_DELETION_FAILED;
    }

    @Override
    public boolean accepts(SagaEvent<UserDeletionFailedPayload> event) {
        return event.payload().failedStep() == SagaStep.COMMUNITY;
    }

    @Override
    public String idempotencyKey(SagaEvent<UserDeletionFailedPayload> event) {
        return "compensation-" + event.eventId();
    }

    @Override
    public Optional<SagaEvent<?>> handle(SagaEvent<UserDeletionFailedPayload> event) {
        log.warn("Compensating message anonymization: userId={}, correlationId={}",
                event.payload().userId(), event.correlationId());
        chatService.restoreUserMessages(event.payload().userId());
        return Optional.empty();
    }
}
