package com.haven.common.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Named circuit breakers for reactive downstream calls.
 *
 * <h3>Call path</h3>
 * <pre>
 * wrap(target, operation, fallback)
 *   └─ CircuitBreakerOperator      OPEN → CallNotPermittedException, operation never subscribed
 *        └─ TimeLimiterOperator    timeout → TimeoutException (recorded as failure)
 *             └─ operation
 *   any error → fallback()
 * </pre>
 *
 * <h3>State machine (Resilience4j)</h3>
 * CLOSED → OPEN once {@code volumeThreshold} calls were recorded and the failure ratio
 * reaches {@code errorThresholdPercentage}. OPEN → HALF_OPEN on the first call after
 * {@code resetTimeout} (no background timer). HALF_OPEN admits exactly one probe:
 * success closes the circuit, failure reopens it.
 *
 * <p>Breakers are created lazily per target inside a {@link ConcurrentHashMap#computeIfAbsent},
 * so creation is serialized per key only.</p>
 */
@Slf4j
public class CircuitBreakerService {

    @Getter
    private final CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
    @Getter
    private final TimeLimiterRegistry timeLimiterRegistry = TimeLimiterRegistry.ofDefaults();

    private final ConcurrentMap<String, CircuitStats> circuits = new ConcurrentHashMap<>();
    private final CircuitOptions defaults;
    private final Clock clock;

    public CircuitBreakerService(CircuitOptions defaults, Clock clock) {
        this.defaults = defaults;
        this.clock = clock;
    }

    public <T> Mono<T> wrap(String target, Supplier<Mono<T>> operation, Supplier<Mono<T>> fallback) {
        return wrap(target, operation, fallback, defaults);
    }

    public <T> Mono<T> wrap(String target, Supplier<Mono<T>> operation, Supplier<Mono<T>> fallback,
                            CircuitOptions options) {
        CircuitStats circuit = circuit(target, options);
        return Mono.defer(operation)
                .transformDeferred(TimeLimiterOperator.of(circuit.getTimeLimiter()))
                .transformDeferred(CircuitBreakerOperator.of(circuit.getCircuitBreaker()))
                .doOnSuccess(result -> circuit.recordSuccess())
                .onErrorResume(error -> {
                    if (error instanceof CallNotPermittedException) {
                        log.debug("Circuit open, serving fallback: target={}", target);
                    } else if (error instanceof TimeoutException) {
                        circuit.recordTimeout();
                        log.warn("Call timed out, serving fallback: target={}, timeout={}",
                                target, options.timeout());
                    } else {
                        circuit.recordFailure();
                        log.warn("Call failed, serving fallback: target={}, error={}", target, error.toString());
                    }
                    circuit.recordFallback();
                    return Mono.defer(fallback);
                });
    }

    public CircuitSnapshot snapshot(String target) {
        CircuitStats circuit = circuits.get(target);
        return circuit != null ? circuit.snapshot() : null;
    }

    public Map<String, CircuitSnapshot> snapshots() {
        Map<String, CircuitSnapshot> result = new TreeMap<>();
        circuits.forEach((name, circuit) -> result.put(name, circuit.snapshot()));
        return result;
    }

    public boolean anyOpen() {
        return circuits.values().stream()
                .anyMatch(circuit -> circuit.snapshot().state() == CircuitState.OPEN);
    }

    /**
     * Holds the target's circuit open regardless of call outcomes, until {@link #reset(String)}.
     */
    public void forceOpen(String target) {
        circuit(target, defaults).getCircuitBreaker().transitionToForcedOpenState();
    }

    public void reset(String target) {
        circuit(target, defaults).getCircuitBreaker().transitionToClosedState();
    }

    private CircuitStats circuit(String target, CircuitOptions options) {
        return circuits.computeIfAbsent(target, name -> {
            CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                    .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                    .slidingWindowSize(Math.max(options.volumeThreshold(), 10))
                    .minimumNumberOfCalls(options.volumeThreshold())
                    .failureRateThreshold(options.errorThresholdPercentage())
                    .waitDurationInOpenState(options.resetTimeout())
                    .permittedNumberOfCallsInHalfOpenState(1)
                    .automaticTransitionFromOpenToHalfOpenEnabled(false)
                    .build();
            TimeLimiterConfig limiterConfig = TimeLimiterConfig.custom()
                    .timeoutDuration(options.timeout())
                    .cancelRunningFuture(true)
                    .build();
            log.info("Circuit created: name={}, timeout={}, threshold={}%, volume={}, reset={}",
                    name, options.timeout(), options.errorThresholdPercentage(),
                    options.volumeThreshold(), options.resetTimeout());
            return new CircuitStats(
                    circuitBreakerRegistry.circuitBreaker(name, breakerConfig),
                    timeLimiterRegistry.timeLimiter(name, limiterConfig),
                    clock);
        });
    }
}
