package com.haven.common.outbox;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Unpublished events, oldest first. The relay stops at the first failure,
     * so events of one user never overtake each other.
     */
    List<OutboxEvent> findTop100ByPublishedFalseOrderByCreatedAtAsc();

    long countByPublishedFalse();
}
