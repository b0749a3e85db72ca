package com.haven.chat.service;

import com.haven.chat.config.ChatProperties;
import com.haven.chat.entity.ChatMessage;
import com.haven.chat.repository.ChatMessageRepository;
import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ChatMessageRepository repository;

    private ChatService chatService;

    @BeforeEach
    void setUp() {
        chatService = new ChatService(repository, ChatProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC),
                Schedulers.immediate());
    }

    private static ChatMessage message(String userId, String content) {
        return ChatMessage.builder().userId(userId).username("Ada").roomId("general")
                .content(content).createdAt(NOW).build();
    }

    @Test
    @DisplayName("History is fetched newest first and returned oldest first")
    void getRecentMessages_oldestFirst() {
        given(repository.findByRoomIdAndDeletedAtIsNullOrderByCreatedAtDesc("general", PageRequest.of(0, 50)))
                .willReturn(List.of(message("user-a", "third"), message("user-a", "second"), message("user-a", "first")));

        StepVerifier.create(chatService.getRecentMessages("general", 50))
                .assertNext(messages -> assertThat(messages).extracting(ChatMessage::getContent)
                        .containsExactly("first", "second", "third"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Only the author may delete a message")
    void deleteMessage_notAuthor() {
        given(repository.findById(5L)).willReturn(Optional.of(message("user-a", "hi")));

        StepVerifier.create(chatService.deleteMessage(5L, "user-b"))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ACCESS_DENIED))
                .verify();
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("Author deletion is a soft delete")
    void deleteMessage_softDeletes() {
        ChatMessage stored = message("user-a", "hi");
        given(repository.findById(5L)).willReturn(Optional.of(stored));

        StepVerifier.create(chatService.deleteMessage(5L, "user-a")).verifyComplete();

        assertThat(stored.getDeletedAt()).isEqualTo(NOW);
        verify(repository).save(stored);
    }

    @Test
    @DisplayName("Anonymization uses the placeholder name and the current time")
    void anonymizeUserMessages() {
        given(repository.anonymizeByUserId("user-a", ChatMessage.ANONYMIZED_USERNAME, NOW)).willReturn(3);

        assertThat(chatService.anonymizeUserMessages("user-a")).isEqualTo(3);
    }
}
