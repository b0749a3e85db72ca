package com.haven.chat.protocol;

import java.util.List;

public record ChatHistoryPayload(String roomId, List<MessagePayload> messages) {
}
