package com.flagship.game_economy.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventEntity.Key> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    /**
     * Claims an event for processing.
     * A concurrent claim of the same event blocks on the row until the first transaction ends.
     *
     * @return 1 if this call inserted the row, 0 if the event was already claimed
     */
    @Modifying
    @Query(value = """
        INSERT INTO processed_events (event_id, event_type, aggregate_type, aggregate_id,
                                      consumer_group, processed_at, processing_result, error_message)
        VALUES (:eventId, :eventType, :aggregateType, :aggregateId,
                :consumerGroup, :processedAt, :result, :errorMessage)
        ON CONFLICT (event_id, consumer_group) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("eventId") UUID eventId,
                       @Param("eventType") String eventType,
                       @Param("aggregateType") String aggregateType,
                       @Param("aggregateId") UUID aggregateId,
                       @Param("consumerGroup") String consumerGroup,
                       @Param("processedAt") Instant processedAt,
                       @Param("result") String result,
                       @Param("errorMessage") String errorMessage);
}
