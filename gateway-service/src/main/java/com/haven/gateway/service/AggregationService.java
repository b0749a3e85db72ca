package com.haven.gateway.service;

import com.haven.common.resilience.CircuitBreakerProperties;
import com.haven.common.resilience.CircuitBreakerService;
import com.haven.common.resilience.CircuitOptions;
import com.haven.gateway.client.AuthServiceClient;
import com.haven.gateway.client.CommunityServiceClient;
import com.haven.gateway.config.DashboardProperties;
import com.haven.gateway.dto.DashboardResponse;
import com.haven.gateway.dto.PostSummary;
import com.haven.gateway.dto.ProfileSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the dashboard from two downstream calls, each behind its own circuit.
 *
 * <h3>Degradation</h3>
 * <pre>
 *   auth-service-profile     live → cache write │ fallback → cached profile, else null
 *   community-service-posts  live → cache write │ fallback → cached posts,   else []
 * </pre>
 * The response is always produced; a degraded part adds its circuit name to {@code degraded}
 * and a line to {@code errors}.
 */
@Slf4j
@Service
public class AggregationService {

    public static final String PROFILE_CIRCUIT = "auth-service-profile";
    public static final String POSTS_CIRCUIT = "community-service-posts";

    static final String PROFILE_UNAVAILABLE = "Profile service unavailable";
    static final String POSTS_UNAVAILABLE = "Community service unavailable";
    static final String CACHED_SUFFIX = " (showing cached data)";

    private final AuthServiceClient authServiceClient;
    private final CommunityServiceClient communityServiceClient;
    private final CircuitBreakerService circuitBreakerService;
    private final DashboardCache dashboardCache;
    private final CircuitOptions downstreamOptions;
    private final int postsLimit;

    public AggregationService(AuthServiceClient authServiceClient,
                              CommunityServiceClient communityServiceClient,
                              CircuitBreakerService circuitBreakerService,
                              DashboardCache dashboardCache,
                              CircuitBreakerProperties circuitBreakerProperties,
                              DashboardProperties dashboardProperties) {
        this.authServiceClient = authServiceClient;
        this.communityServiceClient = communityServiceClient;
        this.circuitBreakerService = circuitBreakerService;
        this.dashboardCache = dashboardCache;
        this.downstreamOptions = circuitBreakerProperties.toOptions()
                .withTimeout(dashboardProperties.downstreamTimeout());
        this.postsLimit = dashboardProperties.postsLimit();
    }

    public Mono<DashboardResponse> getDashboard(String userId) {
        Mono<Sourced<ProfileSummary>> profile = circuitBreakerService.<Sourced<ProfileSummary>>wrap(PROFILE_CIRCUIT,
                () -> authServiceClient.getProfile(userId)
                        .map(response -> Sourced.live(response.data()))
                        .defaultIfEmpty(Sourced.live(null)),
                () -> dashboardCache.getProfile(userId)
                        .map(Sourced::cached)
                        .defaultIfEmpty(Sourced.none(null)),
                downstreamOptions)
                .flatMap(result -> result.isLive() && result.value() != null
                        ? dashboardCache.putProfile(userId, result.value()).thenReturn(result)
                        : Mono.just(result));

        Mono<Sourced<List<PostSummary>>> posts = circuitBreakerService.<Sourced<List<PostSummary>>>wrap(POSTS_CIRCUIT,
                () -> communityServiceClient.getPostsByAuthor(userId, postsLimit)
                        .map(response -> Sourced.live(response.data() != null ? response.data() : List.<PostSummary>of()))
                        .defaultIfEmpty(Sourced.live(List.of())),
                () -> dashboardCache.getPosts(userId)
                        .map(Sourced::cached)
                        .defaultIfEmpty(Sourced.none(List.of())),
                downstreamOptions)
                .flatMap(result -> result.isLive()
                        ? dashboardCache.putPosts(userId, result.value()).thenReturn(result)
                        : Mono.just(result));

        return Mono.zip(profile, posts)
                .map(parts -> assemble(userId, parts.getT1(), parts.getT2()));
    }

    private DashboardResponse assemble(String userId, Sourced<ProfileSummary> profile,
                                       Sourced<List<PostSummary>> posts) {
        List<String> errors = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        if (!profile.isLive()) {
            degraded.add(PROFILE_CIRCUIT);
            errors.add(describe(PROFILE_UNAVAILABLE, profile));
        }
        if (!posts.isLive()) {
            degraded.add(POSTS_CIRCUIT);
            errors.add(describe(POSTS_UNAVAILABLE, posts));
        }
        if (!degraded.isEmpty()) {
            log.warn("Dashboard degraded: userId={}, degraded={}", userId, degraded);
        }
        List<PostSummary> postList = posts.value() != null ? posts.value() : List.of();
        return new DashboardResponse(profile.value(), postList, !degraded.isEmpty(), errors, degraded);
    }

    private String describe(String message, Sourced<?> part) {
        return part.origin() == Sourced.Origin.CACHED ? message + CACHED_SUFFIX : message;
    }
}
