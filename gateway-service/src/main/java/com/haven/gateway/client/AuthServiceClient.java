package com.haven.gateway.client;

import com.haven.common.dto.ApiResponse;
import com.haven.gateway.dto.ProfileSummary;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.service.annotation.GetExchange;
import org.springframework.web.service.annotation.HttpExchange;
import reactor.core.publisher.Mono;

@HttpExchange("/api/profiles")
public interface AuthServiceClient {

    @GetExchange("/{userId}")
    Mono<ApiResponse<ProfileSummary>> getProfile(@PathVariable String userId);
}
