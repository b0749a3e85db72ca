package com.haven.chat.websocket;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room membership of this instance's connections. Empty rooms are dropped.
 */
@Component
public class RoomRegistry {

    private final Map<String, Set<ChatConnection>> rooms = new ConcurrentHashMap<>();

    public void join(String roomId, ChatConnection connection) {
        rooms.compute(roomId, (id, members) -> {
            Set<ChatConnection> updated = members != null ? members : ConcurrentHashMap.newKeySet();
            updated.add(connection);
            return updated;
        });
    }

    public void leave(String roomId, ChatConnection connection) {
        rooms.computeIfPresent(roomId, (id, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
    }

    public Set<ChatConnection> occupants(String roomId) {
        Set<ChatConnection> members = rooms.get(roomId);
        return members != null ? Set.copyOf(members) : Set.of();
    }

    public int roomCount() {
        return rooms.size();
    }
}
