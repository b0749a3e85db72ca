package com.haven.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Downstream base URLs ({@code haven.services.*}), shared by the proxy routes and the
 * aggregation clients.
 */
@ConfigurationProperties(prefix = "haven.services")
public record ServiceEndpoints(
        @DefaultValue("http://localhost:8081") String authUri,
        @DefaultValue("http://localhost:8082") String communityUri,
        @DefaultValue("http://localhost:8083") String chatUri
) {
}
