package com.haven.community.controller;

import com.haven.common.exception.GlobalExceptionHandler;
import com.haven.community.entity.Post;
import com.haven.community.service.PostService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PostControllerTest {

    @Mock
    private PostService postService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PostController(postService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/posts?authorId=..&limit=.. lists the author's posts")
    void getPosts_byAuthor() throws Exception {
        Post post = Post.builder().authorId("user-1").title("Hello").content("First post").build();
        given(postService.getPostsByAuthor("user-1", 10)).willReturn(List.of(post));

        mockMvc.perform(get("/api/posts").param("authorId", "user-1").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].authorId").value("user-1"))
                .andExpect(jsonPath("$.data[0].title").value("Hello"));
    }

    @Test
    @DisplayName("Blank title is rejected before reaching the service")
    void createPost_validation() throws Exception {
        mockMvc.perform(post("/api/posts")
                        .header("X-User-Id", "user-1")
                        .contentType("application/json")
                        .content("{\"title\":\"\",\"content\":\"x\"}"))
                .andExpect(status().isBadRequest());
        verifyNoMoreInteractions(postService);
    }
}
