package com.haven.common.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Saga event waiting to be relayed, stored in the same transaction as the state change
 * that caused it.
 *
 * <h3>Table</h3>
 * <pre>
 *   outbox_events (
 *     id             BIGINT       -- sequence, allocationSize=50
 *     aggregate_type VARCHAR      -- e.g. "Profile"
 *     aggregate_id   VARCHAR      -- user id, used as the message key
 *     event_id       VARCHAR      -- saga envelope eventId, unique
 *     event_type     VARCHAR      -- topic, e.g. "user.deleted"
 *     payload        TEXT         -- full JSON envelope
 *     published      BOOLEAN
 *     attempts       INT          -- failed relay attempts
 *     created_at     TIMESTAMP
 *     published_at   TIMESTAMP
 *   )
 * </pre>
 *
 * Delivery is at-least-once: the relay can crash between send and commit,
 * so subscribers deduplicate on {@code eventId}.
 */
@Entity
@Table(name = "outbox_events", indexes = {
        @Index(name = "idx_outbox_published", columnList = "published, createdAt")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_outbox_event_id", columnNames = "eventId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "outbox_event_seq")
    @SequenceGenerator(name = "outbox_event_seq", sequenceName = "outbox_event_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String aggregateType;

    @Column(nullable = false)
    private String aggregateId;

    @Column(nullable = false, length = 64)
    private String eventId;

    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private boolean published;

    @Column(nullable = false)
    private int attempts;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime publishedAt;

    @Builder
    public OutboxEvent(String aggregateType, String aggregateId, String eventId,
                       String eventType, String payload) {
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventId = eventId;
        this.eventType = eventType;
        this.payload = payload;
        this.published = false;
        this.attempts = 0;
        this.createdAt = LocalDateTime.now();
    }

    public void markPublished() {
        this.published = true;
        this.publishedAt = LocalDateTime.now();
    }

    public void recordFailedAttempt() {
        this.attempts++;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutboxEvent that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
