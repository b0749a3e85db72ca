package com.haven.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of account-deletion saga event kinds.
 *
 * <h3>Wire contract</h3>
 * The topic name is both the broker destination and the {@code eventType} field of the
 * JSON envelope. Each kind is bound to exactly one payload record, so a decoded event is
 * always fully typed and subscribers never switch on raw strings.
 *
 * <pre>
 * user.deleted              → UserDeletedPayload             (auth-service)
 * user.messages_anonymized  → UserMessagesAnonymizedPayload  (chat-service)
 * user.posts_deleted        → UserPostsDeletedPayload        (community-service)
 * user.deletion_failed      → UserDeletionFailedPayload      (any participant)
 * user.restored             → UserRestoredPayload            (auth-service)
 * </pre>
 */
@Getter
@RequiredArgsConstructor
public enum SagaEventType {
    USER_DELETED("user.deleted", UserDeletedPayload.class),
    USER_MESSAGES_ANONYMIZED("user.messages_anonymized", UserMessagesAnonymizedPayload.class),
    USER_POSTS_DELETED("user.posts_deleted", UserPostsDeletedPayload.class),
    USER_DELETION_FAILED("user.deletion_failed", UserDeletionFailedPayload.class),
    USER_RESTORED("user.restored", UserRestoredPayload.class);

    private static final Map<String, SagaEventType> BY_TOPIC = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(SagaEventType::getTopic, Function.identity()));

    private final String topic;
    private final Class<? extends UserScopedPayload> payloadType;

    @JsonValue
    public String wireName() {
        return topic;
    }

    public static Optional<SagaEventType> fromTopic(String topic) {
        return Optional.ofNullable(topic).map(BY_TOPIC::get);
    }

    @JsonCreator
    public static SagaEventType fromWireName(String topic) {
        return fromTopic(topic)
                .orElseThrow(() -> new IllegalArgumentException("Unknown saga event type: " + topic));
    }
}
