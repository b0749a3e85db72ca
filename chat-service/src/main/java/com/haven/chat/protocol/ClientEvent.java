package com.haven.chat.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Events a client may send, by wire name.
 */
public enum ClientEvent {
    JOIN_ROOM("join_room"),
    LEAVE_ROOM("leave_room"),
    SEND_MESSAGE("send_message"),
    TYPING("typing"),
    GET_ROOM_USERS("get_room_users");

    private final String wireName;

    ClientEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ClientEvent> fromWireName(String name) {
        return Arrays.stream(values()).filter(e -> e.wireName.equals(name)).findFirst();
    }
}
