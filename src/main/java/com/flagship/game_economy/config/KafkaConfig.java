package com.flagship.game_economy.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for economy events (trade and season notifications).
 * Keyed by aggregate id, so 3 partitions keep per-trade ordering.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.economy-events:economy-events}")
    private String economyEventsTopic;

    @Bean
    public NewTopic economyEventsTopic() {
        return TopicBuilder.name(economyEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
