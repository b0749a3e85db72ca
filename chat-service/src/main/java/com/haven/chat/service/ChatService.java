package com.haven.chat.service;

import com.haven.chat.config.ChatProperties;
import com.haven.chat.entity.ChatMessage;
import com.haven.chat.repository.ChatMessageRepository;
import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Chat message persistence.
 *
 * <p>JPA is blocking, so every call made from a socket or HTTP event is moved to
 * {@link Schedulers#boundedElastic()} and bounded by {@code haven.chat.persistence-timeout}.
 * The saga operations are called from broker threads and stay blocking.</p>
 */
@Slf4j
@Service
public class ChatService {

    private final ChatMessageRepository repository;
    private final ChatProperties properties;
    private final Clock clock;
    private final Scheduler scheduler;

    @Autowired
    public ChatService(ChatMessageRepository repository, ChatProperties properties, Clock clock) {
        this(repository, properties, clock, Schedulers.boundedElastic());
    }

    ChatService(ChatMessageRepository repository, ChatProperties properties, Clock clock, Scheduler scheduler) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public Mono<ChatMessage> saveMessage(String userId, String username, String roomId,
                                         String content, String clientMessageId) {
        return offload(() -> {
            ChatMessage saved = repository.save(ChatMessage.builder()
                    .userId(userId)
                    .username(username)
                    .roomId(roomId)
                    .content(content)
                    .clientMessageId(clientMessageId)
                    .createdAt(clock.instant())
                    .build());
            log.debug("Chat message saved: id={}, roomId={}", saved.getId(), roomId);
            return saved;
        });
    }

    /**
     * Last {@code limit} visible messages of a room, oldest first.
     */
    public Mono<List<ChatMessage>> getRecentMessages(String roomId, int limit) {
        return offload(() -> {
            List<ChatMessage> newestFirst = repository.findByRoomIdAndDeletedAtIsNullOrderByCreatedAtDesc(
                    roomId, PageRequest.of(0, Math.max(1, limit)));
            List<ChatMessage> oldestFirst = new ArrayList<>(newestFirst);
            Collections.reverse(oldestFirst);
            return oldestFirst;
        });
    }

    /**
     * Moderation delete. Only the author may remove a message.
     */
    public Mono<Void> deleteMessage(Long messageId, String userId) {
        return offload(() -> {
            ChatMessage message = repository.findById(messageId)
                    .filter(m -> !m.isDeleted())
                    .orElseThrow(() -> new BusinessException(ErrorCode.MESSAGE_NOT_FOUND));
            if (!message.getUserId().equals(userId)) {
                throw new BusinessException(ErrorCode.ACCESS_DENIED, "Only the author may delete this message");
            }
            message.markDeleted(clock.instant());
            repository.save(message);
            log.info("Chat message deleted: id={}, userId={}", messageId, userId);
            return message;
        }).then();
    }

    public int anonymizeUserMessages(String userId) {
        int count = repository.anonymizeByUserId(userId, ChatMessage.ANONYMIZED_USERNAME, clock.instant());
        log.info("Chat messages anonymized: userId={}, count={}", userId, count);
        return count;
    }

    public int restoreUserMessages(String userId) {
        int count = repository.restoreByUserId(userId);
        log.info("Chat messages restored: userId={}, count={}", userId, count);
        return count;
    }

    private <T> Mono<T> offload(Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(scheduler)
                .timeout(properties.persistenceTimeout());
    }
}
