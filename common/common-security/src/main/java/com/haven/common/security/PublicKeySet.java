package com.haven.common.security;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide cache of verification keys keyed by {@code kid}.
 *
 * <h3>Refresh rules</h3>
 * <pre>
 * snapshot empty or older than TTL → refresh, then look up
 * lookup miss                      → one refresh, then look up again (no second refresh)
 * still missing                    → InvalidTokenException
 * </pre>
 *
 * <h3>Concurrency</h3>
 * At most one fetch is in flight. Callers arriving during a refresh subscribe to the same
 * pending result instead of starting their own. The snapshot is replaced wholesale
 * (last writer wins). A failed refresh keeps the previous snapshot, and an expired
 * snapshot is still served when the provider cannot be reached.
 */
@Slf4j
public class PublicKeySet {

    private final JwksSource source;
    private final Duration ttl;
    private final Duration fetchTimeout;
    private final Clock clock;

    private final AtomicReference<Mono<KeySnapshot>> inFlight = new AtomicReference<>();
    private volatile KeySnapshot snapshot = KeySnapshot.EMPTY;

    public PublicKeySet(JwksSource source, Duration ttl, Duration fetchTimeout, Clock clock) {
        this.source = source;
        this.ttl = ttl;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
    }

    public Mono<Key> getKey(String kid) {
        return Mono.defer(() -> {
            KeySnapshot current = snapshot;
            if (current.isStale(clock.instant(), ttl)) {
                return refresh()
                        .onErrorResume(e -> current.isEmpty() ? Mono.error(e) : Mono.just(current))
                        .flatMap(fresh -> lookup(fresh, kid, true));
            }
            return lookup(current, kid, false);
        });
    }

    public Instant lastRefreshedAt() {
        return snapshot.fetchedAt();
    }

    private Mono<Key> lookup(KeySnapshot keys, String kid, boolean refreshed) {
        Key key = keys.keys().get(kid);
        if (key != null) {
            return Mono.just(key);
        }
        if (refreshed) {
            return Mono.error(new InvalidTokenException("Unknown key id: " + kid));
        }
        log.info("Key id not cached, refreshing key set: kid={}", kid);
        return refresh().flatMap(fresh -> lookup(fresh, kid, true));
    }

    Mono<KeySnapshot> refresh() {
        Sinks.One<KeySnapshot> sink = Sinks.one();
        Mono<KeySnapshot> pending = sink.asMono();
        Mono<KeySnapshot> existing = inFlight.compareAndExchange(null, pending);
        if (existing != null) {
            return existing;
        }

        source.fetchKeys()
                .timeout(fetchTimeout)
                .switchIfEmpty(Mono.error(new IllegalStateException("Key provider returned no key set")))
                .map(keys -> new KeySnapshot(Map.copyOf(keys), clock.instant()))
                .subscribe(
                        fresh -> {
                            snapshot = fresh;
                            inFlight.set(null);
                            log.debug("Key set refreshed: kids={}", fresh.keys().keySet());
                            sink.tryEmitValue(fresh);
                        },
                        error -> {
                            inFlight.set(null);
                            log.warn("Key set refresh failed: {}", error.toString());
                            sink.tryEmitError(new InvalidTokenException("Key set refresh failed", error));
                        });
        return pending;
    }

    record KeySnapshot(Map<String, Key> keys, Instant fetchedAt) {

        static final KeySnapshot EMPTY = new KeySnapshot(Map.of(), Instant.EPOCH);

        boolean isEmpty() {
            return keys.isEmpty();
        }

        boolean isStale(Instant now, Duration ttl) {
            return isEmpty() || fetchedAt.plus(ttl).isBefore(now);
        }
    }
}
