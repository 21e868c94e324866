package com.flagship.game_economy.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.game_economy.common.event.EconomyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The economy event outbox.
 *
 * Services queue events inside their own transaction, so an event exists exactly when the
 * state change it describes was committed. {@link OutboxPublisher} drains the queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Hands one event to the broker; throwing marks the row as failed.
     */
    @FunctionalInterface
    public interface Sender {
        void send(OutboxEvent event) throws Exception;
    }

    public record DrainResult(int published, int failed, int deferred) {

        public int attempted() {
            return published + failed;
        }
    }

    /**
     * Queues an event in the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(EconomyEvent event) {
        return saveEvent(event.getAggregateType(), event.getAggregateId(), event.getEventType(), event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEventEntity row = repository.save(
                OutboxEventEntity.pending(aggregateType, aggregateId, eventType, toJson(payload)));
        log.debug("Queued outbox event {} for {} {}", eventType, aggregateType, aggregateId);
        return row.toDomain();
    }

    /**
     * Claims the oldest unpublished rows that still have retries left and sends them in commit order.
     *
     * Claimed rows stay locked until the batch commits, so concurrent publishers skip them.
     * Once an event of an aggregate fails, later events of the same aggregate in this batch
     * are deferred, which keeps each aggregate's events in order on the topic.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DrainResult drain(int limit, int maxRetries, Sender sender) {
        List<OutboxEventEntity> rows = repository.findUnpublishedEventsForUpdate(limit, maxRetries);
        Set<UUID> blockedAggregates = new HashSet<>();
        int published = 0;
        int failed = 0;
        int deferred = 0;

        for (OutboxEventEntity row : rows) {
            if (blockedAggregates.contains(row.getAggregateId())) {
                deferred++;
                continue;
            }
            try {
                sender.send(row.toDomain());
                row.markPublished();
                published++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                row.markFailed("Interrupted while publishing");
                failed++;
                break;
            } catch (Exception e) {
                row.markFailed(describe(e));
                blockedAggregates.add(row.getAggregateId());
                failed++;
                log.warn("Outbox event {} ({}) failed to publish, attempt #{}: {}",
                        row.getId(), row.getEventType(), row.getRetryCount(), e.getMessage());
            }
        }
        return new DrainResult(published, failed, deferred);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
