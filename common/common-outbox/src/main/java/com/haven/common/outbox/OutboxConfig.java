package com.haven.common.outbox;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Registers the outbox entity, repository, writer and relay in any service that depends on
 * common-outbox. The service still owns its own {@code @EnableJpaRepositories} for its
 * domain packages and must enable scheduling plus a ShedLock {@code LockProvider}.
 */
@Configuration
@ComponentScan(basePackages = "com.haven.common.outbox")
@EntityScan(basePackages = "com.haven.common.outbox")
@EnableJpaRepositories(basePackages = "com.haven.common.outbox")
public class OutboxConfig {
}
