package com.haven.common.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Polling publisher for {@link OutboxEvent}s.
 *
 * <h3>Flow</h3>
 * <pre>
 *   every haven.outbox.poll-interval (default 1s), one instance at a time (ShedLock):
 *   1. load up to 100 unpublished events, oldest first
 *   2. send each to the destination named by its event type (the topic itself,
 *      e.g. "user.deleted"), kafka_messageKey = aggregateId
 *   3. mark published in the same transaction
 *   4. on the first failure, count the attempt and stop so ordering is kept
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelay {

    private final OutboxEventRepository outboxEventRepository;
    private final StreamBridge streamBridge;

    @Scheduled(fixedDelayString = "${haven.outbox.poll-interval:1000}")
    @SchedulerLock(name = "OutboxRelay_publishPendingEvents",
            lockAtMostFor = "30s", lockAtLeastFor = "500ms")
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findTop100ByPublishedFalseOrderByCreatedAtAsc();
        int published = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                Message<String> message = MessageBuilder
                        .withPayload(event.getPayload())
                        .setHeader("kafka_messageKey", event.getAggregateId())
                        .setHeader("eventType", event.getEventType())
                        .build();

                boolean sent = streamBridge.send(event.getEventType(), message);
                if (!sent) {
                    event.recordFailedAttempt();
                    log.error("StreamBridge send returned false: destination={}, eventId={}, attempts={}",
                            event.getEventType(), event.getEventId(), event.getAttempts());
                    break;
                }

                event.markPublished();
                published++;
                log.info("Outbox relay published: destination={}, eventId={}, aggregateId={}",
                        event.getEventType(), event.getEventId(), event.getAggregateId());
            } catch (Exception e) {
                event.recordFailedAttempt();
                log.error("Outbox relay failed: eventId={}, type={}, attempts={}",
                        event.getEventId(), event.getEventType(), event.getAttempts(), e);
                break;
            }
        }
        return published;
    }
}
