package com.haven.chat.protocol;

import java.util.List;

public record RoomUsersPayload(String roomId, List<RoomUser> users) {

    public record RoomUser(String id, String username) {
    }
}
