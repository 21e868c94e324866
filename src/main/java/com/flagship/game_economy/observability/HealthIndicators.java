package com.flagship.game_economy.observability;

import com.flagship.game_economy.outbox.OutboxEventRepository;
import org.apache.kafka.common.Metric;
import org.apache.kafka.common.MetricName;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health of the infrastructure around the economy core. Only the database is essential:
 * Redis and Kafka outages degrade the service without stopping it.
 */
public class HealthIndicators {

    /**
     * Backlog of unpublished economy events, plus events that exhausted their retries.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            long backlog = outboxRepository.countUnpublished();
            long exhausted = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);

            Health.Builder builder;
            if (backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                builder = Health.down();
            } else if (backlog >= BACKLOG_WARNING_THRESHOLD || exhausted > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("backlogSize", backlog)
                    .withDetail("exhaustedEvents", exhausted)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Redis only backs the transfer idempotency fast path.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String reply = connection.ping();
                return "PONG".equals(reply)
                        ? Health.up().build()
                        : degraded("Unexpected PING reply: " + reply);
            } catch (RuntimeException e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("fallback", "Transfer idempotency keys are read from the database")
                    .build();
        }
    }

    /**
     * Broker connectivity as seen by the outbox producer.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            double connections = 0;
            for (Map.Entry<MetricName, ? extends Metric> metric : kafkaTemplate.metrics().entrySet()) {
                MetricName name = metric.getKey();
                Object value = metric.getValue().metricValue();
                if ("producer-metrics".equals(name.group()) && "connection-count".equals(name.name())
                        && value instanceof Number) {
                    connections += ((Number) value).doubleValue();
                }
            }
            if (connections > 0) {
                return Health.up().withDetail("connections", (long) connections).build();
            }
            return Health.status("DEGRADED")
                    .withDetail("connections", 0)
                    .withDetail("fallback", "Economy events wait in the outbox until the broker is reachable")
                    .build();
        }
    }
}
