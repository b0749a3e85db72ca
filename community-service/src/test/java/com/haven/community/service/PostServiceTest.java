package com.haven.community.service;

import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import com.haven.community.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private PostRepository postRepository;

    private PostService postService;

    @BeforeEach
    void setUp() {
        postService = new PostService(postRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Author listing is capped at the maximum page size")
    void getPostsByAuthor_clampsLimit() {
        given(postRepository.findByAuthorIdAndDeletedAtIsNullOrderByCreatedAtDesc("user-1", PageRequest.of(0, 50)))
                .willReturn(List.of());

        assertThat(postService.getPostsByAuthor("user-1", 500)).isEmpty();
    }

    @Test
    @DisplayName("Saga deletion tags posts with the correlation id and reports the count")
    void deletePostsByUser_tagsWithCorrelation() {
        given(postRepository.softDeleteByAuthor("user-1", NOW, "corr-1")).willReturn(3);

        assertThat(postService.deletePostsByUser("user-1", "corr-1")).isEqualTo(3);
    }

    @Test
    @DisplayName("Restore only touches posts of the same saga run")
    void restorePostsByUser_scopedToCorrelation() {
        given(postRepository.restoreByAuthor("user-1", "corr-1")).willReturn(2);

        assertThat(postService.restorePostsByUser("user-1", "corr-1")).isEqualTo(2);
        verify(postRepository).restoreByAuthor("user-1", "corr-1");
    }

    @Test
    @DisplayName("Missing or hidden post is POST_NOT_FOUND")
    void getPost_notFound() {
        given(postRepository.findByIdAndDeletedAtIsNull(7L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> postService.getPost(7L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.POST_NOT_FOUND);
    }
}
