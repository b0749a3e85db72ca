package com.haven.chat.websocket;

/**
 * Decides whether an authenticated user may enter a room.
 */
public interface RoomAccessPolicy {

    boolean canAccessRoom(String userId, String roomId);
}
