package com.haven.chat.websocket;

/**
 * Lifecycle of one socket.
 *
 * <pre>
 * CONNECTING → AUTHENTICATING → AUTHENTICATED ⇄ IN_ROOM
 *                    │                 │          │
 *                    └─────────────────┴──────────┴→ DISCONNECTED
 * </pre>
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    AUTHENTICATED,
    IN_ROOM,
    DISCONNECTED
}
