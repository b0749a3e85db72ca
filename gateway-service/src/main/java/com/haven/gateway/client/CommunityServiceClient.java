package com.haven.gateway.client;

import com.haven.common.dto.ApiResponse;
import com.haven.gateway.dto.PostSummary;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.service.annotation.GetExchange;
import org.springframework.web.service.annotation.HttpExchange;
import reactor.core.publisher.Mono;

import java.util.List;

@HttpExchange("/api/posts")
public interface CommunityServiceClient {

    /**
     * Most recent posts of one author, newest first.
     */
    @GetExchange
    Mono<ApiResponse<List<PostSummary>>> getPostsByAuthor(@RequestParam("authorId") String authorId,
                                                          @RequestParam("limit") int limit);
}
