package com.haven.community.service;

import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import com.haven.community.dto.CreatePostRequest;
import com.haven.community.entity.Post;
import com.haven.community.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PostService {

    static final int MAX_PAGE_SIZE = 50;

    private final PostRepository postRepository;
    private final Clock clock;

    public List<Post> getRecentPosts(int limit) {
        return postRepository.findByDeletedAtIsNullOrderByCreatedAtDesc(PageRequest.of(0, clamp(limit)));
    }

    /**
     * Newest first. Feeds the gateway dashboard.
     */
    public List<Post> getPostsByAuthor(String authorId, int limit) {
        return postRepository.findByAuthorIdAndDeletedAtIsNullOrderByCreatedAtDesc(
                authorId, PageRequest.of(0, clamp(limit)));
    }

    public Post getPost(Long postId) {
        return postRepository.findByIdAndDeletedAtIsNull(postId)
                .orElseThrow(() -> new BusinessException(ErrorCode.POST_NOT_FOUND));
    }

    @Transactional
    public Post createPost(String authorId, CreatePostRequest request) {
        Post post = postRepository.save(Post.builder()
                .authorId(authorId)
                .title(request.title())
                .content(request.content())
                .category(request.category())
                .build());
        log.info("Post created: postId={}, authorId={}", post.getId(), authorId);
        return post;
    }

    /**
     * Hides every visible post of the user, tagging them with the saga run that did it.
     *
     * @return number of posts hidden by this call
     */
    @Transactional
    public int deletePostsByUser(String userId, String correlationId) {
        int deleted = postRepository.softDeleteByAuthor(userId, clock.instant(), correlationId);
        log.info("Posts soft-deleted: userId={}, count={}, correlationId={}", userId, deleted, correlationId);
        return deleted;
    }

    /**
     * Reverts {@link #deletePostsByUser} for one saga run. Posts removed earlier by other means stay hidden.
     */
    @Transactional
    public int restorePostsByUser(String userId, String correlationId) {
        int restored = postRepository.restoreByAuthor(userId, correlationId);
        log.info("Posts restored: userId={}, count={}, correlationId={}", userId, restored, correlationId);
        return restored;
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    }
}
