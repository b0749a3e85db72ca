package com.haven.chat.websocket;

import com.haven.chat.config.ChatProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Open by default. When {@code haven.chat.allowed-rooms} is set, only those rooms can be joined.
 */
@Component
@RequiredArgsConstructor
public class ConfigurableRoomAccessPolicy implements RoomAccessPolicy {

    private final ChatProperties properties;

    @Override
    public boolean canAccessRoom(String userId, String roomId) {
        return properties.allowedRooms().isEmpty() || properties.allowedRooms().contains(roomId);
    }
}
