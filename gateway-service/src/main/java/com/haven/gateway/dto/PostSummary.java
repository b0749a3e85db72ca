package com.haven.gateway.dto;

import java.time.Instant;

public record PostSummary(Long id, String authorId, String title, String content, Instant createdAt) {
}
