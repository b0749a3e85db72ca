package com.haven.gateway.config;

import com.haven.gateway.client.AuthServiceClient;
import com.haven.gateway.client.CommunityServiceClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.support.WebClientAdapter;
import org.springframework.web.service.invoker.HttpServiceProxyFactory;

/**
 * Declarative HTTP clients for the dashboard sub-calls.
 * Timeouts are not set here; each call is bounded by its circuit's time limiter.
 */
@Configuration
public class ClientConfig {

    @Bean
    public AuthServiceClient authServiceClient(WebClient.Builder builder, ServiceEndpoints endpoints) {
        return proxyFactory(builder.clone().baseUrl(endpoints.authUri()).build())
                .createClient(AuthServiceClient.class);
    }

    @Bean
    public CommunityServiceClient communityServiceClient(WebClient.Builder builder, ServiceEndpoints endpoints) {
        return proxyFactory(builder.clone().baseUrl(endpoints.communityUri()).build())
                .createClient(CommunityServiceClient.class);
    }

    private HttpServiceProxyFactory proxyFactory(WebClient webClient) {
        return HttpServiceProxyFactory.builderFor(WebClientAdapter.create(webClient)).build();
    }
}
