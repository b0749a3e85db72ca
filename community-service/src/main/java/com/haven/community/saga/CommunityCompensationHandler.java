package com.haven.community.saga;

import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.SagaStep;
import com.haven.common.event.UserDeletionFailedPayload;
import com.haven.common.saga.NonRetryableSagaException;
import com.haven.common.saga.SagaEventHandler;
import com.haven.community.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Undoes the post removal when chat-service, the step after this one, fails.
 * A failing compensation is not retried; it is logged for an operator and acknowledged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommunityCompensationHandler implements SagaEventHandler<UserDeletionFailedPayload> {

    private final PostService postService;

    @Override
    public SagaEventType eventType() {
        return SagaEventType.USER_DELETION_FAILED;
    }

    @Override
    public boolean accepts(SagaEvent<UserDeletionFailedPayload> event) {
        return event.payload().failedStep() == SagaStep.CHAT;
    }

    @Override
    public String idempotencyKey(SagaEvent<UserDeletionFailedPayload> event) {
        return "compensation-" + event.eventId();
    }

    @Override
    public Optional<SagaEvent<?>> handle(SagaEvent<UserDeletionFailedPayload> event) {
        String userId = event.payload().userId();
        log.warn("Compensating post deletion: userId={}, correlationId={}", userId, event.correlationId());
        try {
            postService.restorePostsByUser(userId, event.correlationId());
        } catch (RuntimeException e) {
            log.error("COMPENSATION FAILED, manual intervention required: userId={}, step={}, reason={}",
                    userId, SagaStep.COMMUNITY, e.getMessage(), e);
            throw new NonRetryableSagaException("Post restore failed for userId=" + userId, e);
        }
        return Optional.empty();
    }
}
