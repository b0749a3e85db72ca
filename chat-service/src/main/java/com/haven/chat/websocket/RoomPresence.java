package com.haven.chat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.config.ChatProperties;
import com.haven.chat.protocol.RoomUsersPayload.RoomUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cluster-wide room occupancy, kept in one Redis hash per room.
 *
 * <pre>
 * key    chat:room:{roomId}:users
 * field  {instanceId}:{connectionId}
 * value  {"id": userId, "username": username}
 * </pre>
 * Writes are fire-and-forget. Reads merge the hash with this instance's own occupants and fall
 * back to the local view alone when Redis is unavailable.
 */
@Slf4j
@Component
public class RoomPresence {

    static final String KEY_PREFIX = "chat:room:";
    static final String KEY_SUFFIX = ":users";
    /** Stale entries of a crashed instance expire with the key once the room goes quiet. */
    static final Duration KEY_TTL = Duration.ofHours(12);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final RoomRegistry roomRegistry;
    private final ObjectMapper objectMapper;
    private final ChatProperties properties;

    public RoomPresence(ReactiveStringRedisTemplate redisTemplate, RoomRegistry roomRegistry,
                        ObjectMapper objectMapper, ChatProperties properties) {
        this.redisTemplate = redisTemplate;
        this.roomRegistry = roomRegistry;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void register(String roomId, ChatConnection connection) {
        String value;
        try {
            value = objectMapper.writeValueAsString(new RoomUser(connection.getUserId(), connection.getUsername()));
        } catch (JsonProcessingException e) {
            log.warn("Presence entry not serializable: roomId={}, userId={}", roomId, connection.getUserId(), e);
            return;
        }
        String key = key(roomId);
        hash().put(key, field(connection), value)
                .then(redisTemplate.expire(key, KEY_TTL))
                .subscribe(ok -> { }, error -> log.warn("Presence not recorded: roomId={}, userId={}, reason={}",
                        roomId, connection.getUserId(), error.toString()));
    }

    public void unregister(String roomId, ChatConnection connection) {
        hash().remove(key(roomId), field(connection))
                .subscribe(removed -> { }, error -> log.warn("Presence not cleared: roomId={}, userId={}, reason={}",
                        roomId, connection.getUserId(), error.toString()));
    }

    /**
     * @return occupants of the room across all instances, once per user id
     */
    public Mono<List<RoomUser>> users(String roomId) {
        return hash().values(key(roomId))
                .timeout(properties.persistenceTimeout())
                .collectList()
                .map(values -> {
                    Map<String, RoomUser> users = new LinkedHashMap<>();
                    values.forEach(value -> decode(roomId, value).ifPresent(user -> users.putIfAbsent(user.id(), user)));
                    localUsers(roomId).forEach(user -> users.putIfAbsent(user.id(), user));
                    return List.copyOf(users.values());
                })
                .onErrorResume(e -> {
                    log.warn("Presence unavailable, listing local occupants only: roomId={}, reason={}",
                            roomId, e.toString());
                    return Mono.just(localUsers(roomId));
                });
    }

    List<RoomUser> localUsers(String roomId) {
        Map<String, RoomUser> users = new LinkedHashMap<>();
        roomRegistry.occupants(roomId).stream()
                .filter(ChatConnection::isAuthenticated)
                .forEach(member -> users.putIfAbsent(member.getUserId(),
                        new RoomUser(member.getUserId(), member.getUsername())));
        return List.copyOf(users.values());
    }

    private Optional<RoomUser> decode(String roomId, String value) {
        try {
            RoomUser user = objectMapper.readValue(value, RoomUser.class);
            return user != null && user.id() != null ? Optional.of(user) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable presence entry: roomId={}", roomId);
            return Optional.empty();
        }
    }

    private ReactiveHashOperations<String, String, String> hash() {
        return redisTemplate.opsForHash();
    }

    private String field(ChatConnection connection) {
        return properties.instanceId() + ":" + connection.getConnectionId();
    }

    static String key(String roomId) {
        return KEY_PREFIX + roomId + KEY_SUFFIX;
    }
}
