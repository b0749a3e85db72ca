package com.haven.common.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerServiceTest {

    private static final String TARGET = "community-service-posts";
    private static final CircuitOptions OPTIONS =
            new CircuitOptions(Duration.ofMillis(500), 50, 4, Duration.ofMillis(200));

    private final AtomicInteger invocations = new AtomicInteger();
    private CircuitBreakerService service;

    @BeforeEach
    void setUp() {
        service = new CircuitBreakerService(CircuitOptions.defaults(), Clock.systemUTC());
    }

    private Mono<String> call(Mono<String> outcome) {
        return service.wrap(TARGET, () -> {
            invocations.incrementAndGet();
            return outcome;
        }, () -> Mono.just("fallback"), OPTIONS);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            StepVerifier.create(call(Mono.error(new IllegalStateException("boom"))))
                    .expectNext("fallback")
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Successful calls pass through and are counted")
    void closed_successPassesThrough() {
        StepVerifier.create(call(Mono.just("posts"))).expectNext("posts").verifyComplete();

        CircuitSnapshot snapshot = service.snapshot(TARGET);
        assertThat(snapshot.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(snapshot.successes()).isEqualTo(1);
        assertThat(snapshot.fallbacks()).isZero();
    }

    @Test
    @DisplayName("Below the volume threshold the circuit stays closed even at 100% failures")
    void closed_belowVolumeThreshold_staysClosed() {
        failTimes(3);

        assertThat(service.snapshot(TARGET).state()).isEqualTo(CircuitState.CLOSED);
        assertThat(invocations.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Circuit opens at the volume threshold and stops invoking the operation")
    void opensAndStopsCalling() {
        failTimes(4);
        assertThat(service.snapshot(TARGET).state()).isEqualTo(CircuitState.OPEN);
        assertThat(service.anyOpen()).isTrue();

        for (int i = 0; i < 5; i++) {
            StepVerifier.create(call(Mono.just("should not run"))).expectNext("fallback").verifyComplete();
        }

        CircuitSnapshot snapshot = service.snapshot(TARGET);
        assertThat(invocations.get()).isEqualTo(4);
        assertThat(snapshot.failures()).isEqualTo(4);
        assertThat(snapshot.fallbacks()).isEqualTo(9);
        assertThat(snapshot.openedAt()).isNotNull();
    }

    @Test
    @DisplayName("After the reset interval a successful probe closes the circuit and resets counters")
    void halfOpenProbe_success_closes() throws InterruptedException {
        failTimes(4);
        Thread.sleep(300);

        StepVerifier.create(call(Mono.just("recovered"))).expectNext("recovered").verifyComplete();

        CircuitSnapshot snapshot = service.snapshot(TARGET);
        assertThat(snapshot.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(snapshot.failures()).isZero();
        assertThat(snapshot.successes()).isEqualTo(1);
        assertThat(invocations.get()).isEqualTo(5);
    }

    @Test
    @DisplayName("A failed probe reopens the circuit")
    void halfOpenProbe_failure_reopens() throws InterruptedException {
        failTimes(4);
        Thread.sleep(300);

        failTimes(1);

        assertThat(service.snapshot(TARGET).state()).isEqualTo(CircuitState.OPEN);
        StepVerifier.create(call(Mono.just("x"))).expectNext("fallback").verifyComplete();
        assertThat(invocations.get()).isEqualTo(5);
    }

    @Test
    @DisplayName("Half-open admits exactly one trial call while the probe is in flight")
    void halfOpen_singleTrial() throws InterruptedException {
        failTimes(4);
        Thread.sleep(300);

        Sinks.One<String> probe = Sinks.one();
        List<String> probeResult = new ArrayList<>();
        call(probe.asMono()).subscribe(probeResult::add);
        assertThat(service.snapshot(TARGET).state()).isEqualTo(CircuitState.HALF_OPEN);

        StepVerifier.create(call(Mono.just("concurrent"))).expectNext("fallback").verifyComplete();
        assertThat(invocations.get()).isEqualTo(5);

        probe.tryEmitValue("probe-ok");
        assertThat(probeResult).containsExactly("probe-ok");
        assertThat(service.snapshot(TARGET).state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("A timeout is a failure, is counted as a timeout and yields the fallback")
    void timeout_countsAsFailure() {
        StepVerifier.create(call(Mono.never()))
                .expectNext("fallback")
                .verifyComplete();

        CircuitSnapshot snapshot = service.snapshot(TARGET);
        assertThat(snapshot.timeouts()).isEqualTo(1);
        assertThat(snapshot.failures()).isEqualTo(1);
        assertThat(snapshot.fallbacks()).isEqualTo(1);
    }

    @Test
    @DisplayName("Forced-open circuit serves fallbacks until reset")
    void forceOpen_thenReset() {
        service.forceOpen(TARGET);

        StepVerifier.create(call(Mono.just("live"))).expectNext("fallback").verifyComplete();
        assertThat(invocations.get()).isZero();
        assertThat(service.snapshots()).containsKey(TARGET);

        service.reset(TARGET);
        StepVerifier.create(call(Mono.just("live"))).expectNext("live").verifyComplete();
    }
}
