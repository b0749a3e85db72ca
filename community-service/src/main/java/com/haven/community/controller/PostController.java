package com.haven.community.controller;

import com.haven.common.dto.ApiResponse;
import com.haven.community.dto.CreatePostRequest;
import com.haven.community.dto.PostResponse;
import com.haven.community.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/posts")
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    /**
     * {@code authorId} narrows the listing to one user; the gateway dashboard calls it that way.
     */
    @GetMapping
    public ApiResponse<List<PostResponse>> getPosts(
            @RequestParam(required = false) String authorId,
            @RequestParam(defaultValue = "20") int limit) {
        var posts = authorId != null
                ? postService.getPostsByAuthor(authorId, limit)
                : postService.getRecentPosts(limit);
        return ApiResponse.ok(posts.stream().map(PostResponse::from).toList());
    }

    @GetMapping("/{postId}")
    public ApiResponse<PostResponse> getPost(@PathVariable Long postId) {
        return ApiResponse.ok(PostResponse.from(postService.getPost(postId)));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<PostResponse> createPost(@RequestHeader("X-User-Id") String userId,
                                                @Valid @RequestBody CreatePostRequest request) {
        return ApiResponse.ok(PostResponse.from(postService.createPost(userId, request)));
    }
}
