package com.haven.auth.saga;

import com.haven.auth.service.AccountService;
import com.haven.auth.service.ProfileService;
import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.UserDeletionFailedPayload;
import com.haven.common.event.UserRestoredPayload;
import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import com.haven.common.saga.NonRetryableSagaException;
import com.haven.common.saga.SagaEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Compensation at the saga origin: any participant's failure brings the profile back.
 * A second failure event for the same user finds the profile active and emits nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileRestoreHandler implements SagaEventHandler<UserDeletionFailedPayload> {

    private final ProfileService profileService;
    private final Clock clock;

    @Override
    public SagaEventType eventType() {
        return SagaEventType.USER_DELETION_FAILED;
    }

    @Override
    public Optional<SagaEvent<?>> handle(SagaEvent<UserDeletionFailedPayload> event) {
        UserDeletionFailedPayload payload = event.payload();
        log.warn("Account deletion failed, restoring profile: userId={}, failedStep={}, reason={}",
                payload.userId(), payload.failedStep(), payload.reason());
        try {
            return profileService.restoreProfile(payload.userId())
                    .<SagaEvent<?>>map(profile -> event.followUp(SagaEventType.USER_RESTORED,
                            new UserRestoredPayload(profile.getId(), clock.instant()),
                            AccountService.SOURCE_SERVICE));
        } catch (BusinessException e) {
            if (e.getErrorCode() == ErrorCode.PROFILE_NOT_FOUND) {
                throw new NonRetryableSagaException("No profile to restore: userId=" + payload.userId(), e);
            }
            throw e;
        }
    }
}
