package com.flagship.game_economy.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The processed_events row is claimed first, in the same transaction as the handler's own
 * database work. A concurrent delivery of the same event waits on that row and then sees
 * it as a duplicate. A failing handler rolls the claim back with everything else and the
 * exception propagates, leaving the Kafka offset uncommitted for redelivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(EventEnvelope envelope, String consumerGroup, Runnable handler) {
        if (!claim(ProcessedEvent.success(envelope, consumerGroup))) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    envelope.eventId(), consumerGroup);
            return false;
        }

        handler.run();

        log.debug("Processed event {} ({}) by consumer group {}",
                envelope.eventId(), envelope.eventType(), consumerGroup);
        return true;
    }

    /**
     * Marks an event as seen without handling it.
     */
    @Transactional
    public void skipEvent(EventEnvelope envelope, String consumerGroup, String reason) {
        if (claim(ProcessedEvent.skipped(envelope, consumerGroup, reason))) {
            log.debug("Skipped event {} by consumer group {}: {}", envelope.eventId(), consumerGroup, reason);
        }
    }

    public boolean isAlreadyProcessed(EventEnvelope envelope, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(envelope.eventId(), consumerGroup);
    }

    private boolean claim(ProcessedEvent event) {
        return repository.insertIfAbsent(
            event.getEventId(),
            event.getEventType(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getConsumerGroup(),
            event.getProcessedAt(),
            event.getResult().name(),
            event.getErrorMessage()
        ) == 1;
    }
}
