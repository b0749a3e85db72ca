package com.haven.auth.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * OutboxConfig narrows entity and repository scanning to the outbox package,
 * so this service declares its own packages explicitly.
 */
@Configuration
@EnableJpaAuditing
@EntityScan(basePackages = "com.haven.auth.entity")
@EnableJpaRepositories(basePackages = "com.haven.auth.repository")
public class JpaConfig {
}
