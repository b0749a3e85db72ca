package com.haven.gateway.controller;

import com.haven.gateway.dto.DashboardResponse;
import com.haven.gateway.filter.JwtAuthFilter;
import com.haven.gateway.service.AggregationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class DashboardController {

    private final AggregationService aggregationService;

    /**
     * Always 200; degraded parts are reported inside the body.
     */
    @GetMapping("/dashboard")
    public Mono<DashboardResponse> dashboard(@RequestHeader(JwtAuthFilter.USER_ID_HEADER) String userId) {
        return aggregationService.getDashboard(userId);
    }
}
