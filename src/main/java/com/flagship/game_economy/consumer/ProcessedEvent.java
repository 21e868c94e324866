package com.flagship.game_economy.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED     // not relevant to this consumer
    }

    public static ProcessedEvent success(EventEnvelope envelope, String consumerGroup) {
        return of(envelope, consumerGroup, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(EventEnvelope envelope, String consumerGroup, String reason) {
        return of(envelope, consumerGroup, ProcessingResult.SKIPPED, reason);
    }

    private static ProcessedEvent of(EventEnvelope envelope, String consumerGroup,
                                     ProcessingResult result, String message) {
        return new ProcessedEvent(
            envelope.eventId(),
            envelope.eventType(),
            envelope.aggregateType(),
            envelope.aggregateId(),
            consumerGroup,
            Instant.now(),
            result,
            message
        );
    }
}
