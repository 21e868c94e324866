package com.flagship.game_economy.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Read side of processed_events. Rows are only ever written by
 * {@link ProcessedEventRepository#insertIfAbsent}, one per event and consumer group.
 */
@Entity
@Immutable
@IdClass(ProcessedEventEntity.Key.class)
@Table(name = "processed_events")
@Getter
@NoArgsConstructor
public class ProcessedEventEntity {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private UUID eventId;
        private String consumerGroup;
    }

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Id
    @Column(name = "consumer_group")
    private String consumerGroup;

    @Column(name = "event_type")
    private String eventType;

    @Column(name = "aggregate_type")
    private String aggregateType;

    @Column(name = "aggregate_id")
    private UUID aggregateId;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result")
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "error_message")
    private String errorMessage;
}
