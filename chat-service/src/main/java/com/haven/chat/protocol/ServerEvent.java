package com.haven.chat.protocol;

/**
 * Events the server emits, by wire name.
 */
public enum ServerEvent {
    CONNECTED("connected"),
    ERROR("error"),
    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    CHAT_HISTORY("chat_history"),
    RECEIVE_MESSAGE("receive_message"),
    MESSAGE_SENT("message_sent"),
    USER_TYPING("user_typing"),
    ROOM_USERS("room_users");

    private final String wireName;

    ServerEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
