package com.haven.common.resilience;

import java.time.Duration;

/**
 * Per-target breaker settings. Applied when the target's breaker is first created;
 * later calls with different options reuse the existing breaker.
 *
 * @param timeout                  bound on a single call; exceeding it counts as a failure
 * @param errorThresholdPercentage failure ratio (0-100) that opens the circuit
 * @param volumeThreshold          calls recorded before the ratio is evaluated
 * @param resetTimeout             time spent open before the next call becomes a half-open probe
 */
public record CircuitOptions(
        Duration timeout,
        int errorThresholdPercentage,
        int volumeThreshold,
        Duration resetTimeout
) {

    public static CircuitOptions defaults() {
        return new CircuitOptions(Duration.ofMillis(5000), 50, 5, Duration.ofMillis(30000));
    }

    public CircuitOptions withTimeout(Duration newTimeout) {
        return new CircuitOptions(newTimeout, errorThresholdPercentage, volumeThreshold, resetTimeout);
    }
}
