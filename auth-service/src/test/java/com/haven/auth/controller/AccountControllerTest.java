package com.haven.auth.controller;

import com.haven.auth.dto.AccountDeletionResponse;
import com.haven.auth.service.AccountService;
import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import com.haven.common.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AccountControllerTest {

    @Mock
    private AccountService accountService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AccountController(accountService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("DELETE /api/account answers 202 right away")
    void delete_accepted() throws Exception {
        given(accountService.deleteAccount("user-1", "ada@haven.test"))
                .willReturn(new AccountDeletionResponse("user-1", "Account deletion initiated", "corr-1"));

        mockMvc.perform(delete("/api/account")
                        .header("X-User-Id", "user-1")
                        .header("X-User-Email", "ada@haven.test"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.userId").value("user-1"))
                .andExpect(jsonPath("$.data.message").value("Account deletion initiated"));
    }

    @Test
    @DisplayName("Deletion already in progress maps to 409")
    void delete_conflict() throws Exception {
        given(accountService.deleteAccount("user-1", null))
                .willThrow(new BusinessException(ErrorCode.ACCOUNT_ALREADY_DELETED));

        mockMvc.perform(delete("/api/account").header("X-User-Id", "user-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }
}
