package com.haven.common.resilience;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Read-only view of one target's circuit, as exposed by {@code GET /circuits/status}.
 * {@code failures} includes timeouts; {@code openedAt} is only set while open.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitSnapshot(
        CircuitState state,
        long failures,
        long successes,
        long fallbacks,
        long timeouts,
        Instant openedAt
) {
}
