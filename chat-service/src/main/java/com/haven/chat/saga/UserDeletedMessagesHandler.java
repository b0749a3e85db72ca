package com.haven.chat.saga;

import com.haven.chat.service.ChatService;
import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.SagaStep;
import com.haven.common.event.UserDeletedPayload;
import com.haven.common.event.UserDeletionFailedPayload;
import com.haven.common.event.UserMessagesAnonymizedPayload;
import com.haven.common.saga.SagaEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Chat step of the account-deletion saga. Messages are kept for the other participants
 * of a conversation, so they are anonymized instead of removed.
 *
 * <pre>
 * user.deleted → anonymize messages → user.messages_anonymized
 *                       ✗           → user.deletion_failed(step=chat)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class UserDeletedMessagesHandler implements SagaEventHandler<UserDeletedPayload> {

    static final String SOURCE_SERVICE = "chat-service";

    private final ChatService chatService;
    private final Clock clock;

    @Override
    public SagaEventType eventType() {
        return SagaEventType.USER_DELETED;
    }

    @Override
    public Optional<SagaEvent<?>> handle(SagaEvent<UserDeletedPayload> event) {
        String userId = event.payload().userId();
        int anonymized = chatService.anonymizeUserMessages(userId);
        return Optional.of(event.followUp(SagaEventType.USER_MESSAGES_ANONYMIZED,
                new UserMessagesAnonymizedPayload(userId, anonymized, clock.instant()), SOURCE_SERVICE));
    }

    @Override
    public Optional<SagaEvent<?>> onFailure(SagaEvent<UserDeletedPayload> event, Exception cause) {
        return Optional.of(event.followUp(SagaEventType.USER_DELETION_FAILED,
                new UserDeletionFailedPayload(event.payload().userId(), SagaStep.CHAT,
                        cause.getMessage(), event.eventId()),
                SOURCE_SERVICE));
    }
}
