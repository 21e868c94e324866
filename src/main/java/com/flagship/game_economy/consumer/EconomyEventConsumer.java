package com.flagship.game_economy.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.game_economy.observability.CorrelationContext;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * Consumes the economy-events topic and fans each event out to the audit sink
 * and the real-time notifier of every recipient.
 *
 * Offsets are acknowledged manually after processing; duplicates from replays or
 * rebalances are filtered by {@link IdempotentEventProcessor}.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EconomyEventConsumer {

    static final String CONSUMER_GROUP = "economy-event-fanout";

    private static final Set<String> KNOWN_AGGREGATES = Set.of("Trade", "Currency", "Season", "Shop");

    private final IdempotentEventProcessor eventProcessor;
    private final RecipientNotifier recipientNotifier;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper;
    private final EconomyMetrics metrics;

    @KafkaListener(
        topics = "${kafka.topic.economy-events:economy-events}",
        groupId = "${spring.kafka.consumer.group-id:game-economy-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        EventEnvelope envelope;
        try {
            envelope = EventEnvelope.fromJson(objectMapper.readTree(record.value()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable economy event at offset {}, acknowledging to skip: {}",
                    record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.forEvent(envelope.eventId()));
        try {
            handle(envelope, record.value());
            ack.acknowledge();
        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(envelope.eventType(), e.getClass().getSimpleName());
            log.error("Error processing event {} at offset {}: {}",
                    envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    void handle(EventEnvelope envelope, String payload) {
        if (!KNOWN_AGGREGATES.contains(envelope.aggregateType())) {
            eventProcessor.skipEvent(envelope, CONSUMER_GROUP, "Unknown aggregate type");
            return;
        }

        boolean processed = eventProcessor.processEvent(envelope, CONSUMER_GROUP, () -> {
            auditSink.record(envelope, payload);
            for (UUID recipientId : envelope.recipientIds()) {
                recipientNotifier.notify(recipientId, envelope.eventType(), payload);
            }
        });
        metrics.recordEventProcessed(envelope.eventType(), processed);

        if (processed) {
            log.info("Fanned out event: type={}, eventId={}, recipients={}",
                    envelope.eventType(), envelope.eventId(), envelope.recipientIds().size());
        }
    }
}
