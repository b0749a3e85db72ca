package com.haven.community.saga;

import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.SagaStep;
import com.haven.common.event.UserDeletedPayload;
import com.haven.common.event.UserDeletionFailedPayload;
import com.haven.common.event.UserPostsDeletedPayload;
import com.haven.common.saga.SagaEventHandler;
import com.haven.community.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Community step of the account-deletion saga: hide the user's posts.
 *
 * <pre>
 * user.deleted → soft delete posts → user.posts_deleted
 *                       ✗          → user.deletion_failed(step=community)
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserDeletedPostsHandler implements SagaEventHandler<UserDeletedPayload> {

    static final String SOURCE_SERVICE = "community-service";

    private final PostService postService;
    private final Clock clock;

    @Override
    public SagaEventType eventType() {
        return SagaEventType.USER_DELETED;
    }

    @Override
    public Optional<SagaEvent<?>> handle(SagaEvent<UserDeletedPayload> event) {
        String userId = event.payload().userId();
        int deleted = postService.deletePostsByUser(userId, event.correlationId());
        return Optional.of(event.followUp(SagaEventType.USER_POSTS_DELETED,
                new UserPostsDeletedPayload(userId, deleted, clock.instant()), SOURCE_SERVICE));
    }

    @Override
    public Optional<SagaEvent<?>> onFailure(SagaEvent<UserDeletedPayload> event, Exception cause) {
        return Optional.of(event.followUp(SagaEventType.USER_DELETION_FAILED,
                new UserDeletionFailedPayload(event.payload().userId(), SagaStep.COMMUNITY,
                        cause.getMessage(), event.eventId()),
                SOURCE_SERVICE));
    }
}
