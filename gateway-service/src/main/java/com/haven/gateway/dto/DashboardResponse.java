package com.haven.gateway.dto;

import java.util.List;

/**
 * Combined view returned by {@code GET /dashboard}.
 *
 * @param profile  caller's profile, {@code null} when unavailable and not cached
 * @param posts    recent posts, empty when unavailable and not cached
 * @param cached   {@code true} when any part was served by a fallback
 * @param errors   one human-readable line per degraded part
 * @param degraded circuit names that fell back
 */
public record DashboardResponse(
        ProfileSummary profile,
        List<PostSummary> posts,
        boolean cached,
        List<String> errors,
        List<String> degraded
) {
}
