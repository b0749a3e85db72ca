package com.haven.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param downstreamTimeout per-call bound for each dashboard sub-call
 * @param postsLimit        number of recent posts shown
 * @param cacheTtl          lifetime of the last good sub-results used as fallback
 */
@ConfigurationProperties(prefix = "haven.dashboard")
public record DashboardProperties(
        @DefaultValue("4s") Duration downstreamTimeout,
        @DefaultValue("10") int postsLimit,
        @DefaultValue("5m") Duration cacheTtl
) {
}
