package com.haven.gateway.dto;

public record ProfileSummary(String id, String email, String displayName, String avatarUrl) {
}
