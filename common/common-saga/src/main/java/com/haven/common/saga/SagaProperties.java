package com.haven.common.saga;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Saga participant settings ({@code haven.saga.*}).
 *
 * @param serviceName    emitter name in event metadata; also namespaces idempotency keys so
 *                       two services consuming the same event never see each other's marks
 * @param idempotencyTtl how long a processed mark is kept
 * @param nackBackoff    pause before the broker redelivers a requeued message
 */
@ConfigurationProperties(prefix = "haven.saga")
public record SagaProperties(
        String serviceName,
        @DefaultValue("24h") Duration idempotencyTtl,
        @DefaultValue("1s") Duration nackBackoff
) {
}
