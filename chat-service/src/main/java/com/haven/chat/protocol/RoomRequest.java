package com.haven.chat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code join_room}, {@code leave_room} and {@code get_room_users}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomRequest(String roomId) {
}
