package com.haven.auth.controller;

import com.haven.auth.dto.AccountDeletionResponse;
import com.haven.auth.service.AccountService;
import com.haven.common.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/account")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    /**
     * Answers 202 once deletion is recorded; data removal in other services follows asynchronously.
     */
    @DeleteMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<AccountDeletionResponse> deleteAccount(
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-User-Email", required = false) String email) {
        AccountDeletionResponse response = accountService.deleteAccount(userId, email);
        return ApiResponse.accepted(response, response.message());
    }
}
