package com.haven.common.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and Resilience4j instances for one named target.
 * Only {@link CircuitBreakerService} writes to it.
 */
@Slf4j
class CircuitStats {

    @Getter
    private final CircuitBreaker circuitBreaker;
    @Getter
    private final TimeLimiter timeLimiter;
    private final Clock clock;

    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private volatile Instant openedAt;

    CircuitStats(CircuitBreaker circuitBreaker, TimeLimiter timeLimiter, Clock clock) {
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.clock = clock;
        circuitBreaker.getEventPublisher().onStateTransition(this::onStateTransition);
    }

    void recordSuccess() {
        successes.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    void recordTimeout() {
        timeouts.incrementAndGet();
        failures.incrementAndGet();
    }

    void recordFallback() {
        fallbacks.incrementAndGet();
    }

    CircuitSnapshot snapshot() {
        CircuitState state = CircuitState.of(circuitBreaker.getState());
        return new CircuitSnapshot(state, failures.get(), successes.get(), fallbacks.get(), timeouts.get(),
                state == CircuitState.OPEN ? openedAt : null);
    }

    private void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        String name = event.getCircuitBreakerName();
        switch (event.getStateTransition().getToState()) {
            case OPEN, FORCED_OPEN -> {
                openedAt = clock.instant();
                log.warn("Circuit OPEN: name={}, failureRate={}%, failures={}",
                        name, circuitBreaker.getMetrics().getFailureRate(), failures.get());
            }
            case HALF_OPEN -> log.info("Circuit HALF_OPEN, probing: name={}", name);
            case CLOSED -> {
                failures.set(0);
                successes.set(0);
                openedAt = null;
                log.info("Circuit CLOSED: name={}", name);
            }
            default -> log.info("Circuit transition: name={}, transition={}", name, event.getStateTransition());
        }
    }
}
