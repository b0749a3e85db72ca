package com.haven.auth.service;

import com.haven.auth.dto.AccountDeletionResponse;
import com.haven.auth.entity.Profile;
import com.haven.auth.repository.ProfileRepository;
import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.UserDeletedPayload;
import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import com.haven.common.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Starts the account-deletion saga.
 *
 * <h3>★ Saga origin</h3>
 * <pre>
 *   one local transaction:
 *     profiles.deleted_at = now
 *     outbox_events += user.deleted
 *   → OutboxRelay publishes, chat-service and community-service react
 *   → on user.deletion_failed, ProfileRestoreHandler clears deleted_at
 * </pre>
 * The caller gets its answer right after the commit; the rest of the saga is asynchronous.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    public static final String SOURCE_SERVICE = "auth-service";
    static final String DELETION_REASON = "User requested account deletion";
    static final String DELETION_MESSAGE = "Account deletion initiated";

    private final ProfileRepository profileRepository;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public AccountDeletionResponse deleteAccount(String userId, String email) {
        Profile profile = profileRepository.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PROFILE_NOT_FOUND));
        if (profile.isDeleted()) {
            throw new BusinessException(ErrorCode.ACCOUNT_ALREADY_DELETED);
        }

        Instant now = clock.instant();
        profile.markDeleted(now);

        String resolvedEmail = email != null && !email.isBlank() ? email : profile.getEmail();
        SagaEvent<UserDeletedPayload> event = SagaEvent.create(SagaEventType.USER_DELETED,
                new UserDeletedPayload(userId, resolvedEmail, now, DELETION_REASON),
                SOURCE_SERVICE, null);
        outboxService.saveEvent("Profile", event);

        log.info("Account deletion initiated: userId={}, eventId={}, correlationId={}",
                userId, event.eventId(), event.correlationId());
        return new AccountDeletionResponse(userId, DELETION_MESSAGE, event.correlationId());
    }
}
