package com.flagship.game_economy.outbox;

import com.flagship.game_economy.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox to the economy-events topic.
 *
 * Records are keyed by aggregate id, so every event of one trade, transaction or progression
 * lands on one partition. A row is marked published only after the broker acknowledged it;
 * rows that exhaust their retries stay in the table for manual inspection.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "eventType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.economy-events:economy-events}")
    private String economyEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            OutboxService.DrainResult result = outboxService.drain(batchSize, maxRetries, this::send);
            if (result.attempted() > 0) {
                log.debug("Outbox drain: published={}, failed={}, deferred={}",
                        result.published(), result.failed(), result.deferred());
            }
        } catch (RuntimeException e) {
            log.error("Outbox drain failed", e);
        }
    }

    private void send(OutboxEvent event) throws Exception {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(economyEventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published {} {} to partition {} at offset {}",
                    event.getEventType(), event.getId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (Exception e) {
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            throw e;
        }
    }

    /**
     * Runs one drain immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
