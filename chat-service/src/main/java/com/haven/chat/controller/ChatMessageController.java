package com.haven.chat.controller;

import com.haven.chat.protocol.MessagePayload;
import com.haven.chat.service.ChatService;
import com.haven.common.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * HTTP access to stored messages: room history and author deletion.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatMessageController {

    private final ChatService chatService;

    @GetMapping("/rooms/{roomId}/messages")
    public Mono<ApiResponse<List<MessagePayload>>> getHistory(@PathVariable String roomId,
                                                              @RequestParam(defaultValue = "50") int limit) {
        return chatService.getRecentMessages(roomId, Math.min(limit, 200))
                .map(messages -> ApiResponse.ok(messages.stream().map(MessagePayload::from).toList()));
    }

    @DeleteMapping("/messages/{messageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteMessage(@PathVariable Long messageId, @RequestHeader("X-User-Id") String userId) {
        return chatService.deleteMessage(messageId, userId);
    }
}
