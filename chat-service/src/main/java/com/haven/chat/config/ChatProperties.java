package com.haven.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

/**
 * Real-time gateway settings ({@code haven.chat.*}).
 *
 * @param historyLimit        messages replayed to a joiner
 * @param maxMessageLength    longest accepted message, after trimming
 * @param authTimeout         bound on handshake token verification
 * @param persistenceTimeout  bound on each database call made from a socket event
 * @param backplaneChannel    Redis pub/sub channel shared by all instances
 * @param instanceId          identity of this instance on the backplane; random when unset
 * @param allowedRooms        rooms open to every authenticated user; empty means all rooms
 */
@ConfigurationProperties(prefix = "haven.chat")
public record ChatProperties(
        @DefaultValue("50") int historyLimit,
        @DefaultValue("5000") int maxMessageLength,
        @DefaultValue("5s") Duration authTimeout,
        @DefaultValue("3s") Duration persistenceTimeout,
        @DefaultValue("chat:broadcast") String backplaneChannel,
        String instanceId,
        @DefaultValue Set<String> allowedRooms
) {

    public ChatProperties {
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = UUID.randomUUID().toString();
        }
        allowedRooms = allowedRooms != null ? Set.copyOf(allowedRooms) : Set.of();
    }

    public static ChatProperties defaults() {
        return new ChatProperties(50, 5000, Duration.ofSeconds(5), Duration.ofSeconds(3),
                "chat:broadcast", null, Set.of());
    }
}
