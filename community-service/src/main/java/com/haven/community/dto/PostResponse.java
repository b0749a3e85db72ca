package com.haven.community.dto;

import com.haven.community.entity.Post;

import java.time.Instant;

public record PostResponse(
        Long id,
        String authorId,
        String title,
        String content,
        String category,
        Instant createdAt
) {

    public static PostResponse from(Post post) {
        return new PostResponse(post.getId(), post.getAuthorId(), post.getTitle(),
                post.getContent(), post.getCategory(), post.getCreatedAt());
    }
}
