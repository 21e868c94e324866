package com.flagship.game_economy.consumer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The routing fields every economy event payload carries.
 */
public record EventEnvelope(UUID eventId,
                            String eventType,
                            String aggregateType,
                            UUID aggregateId,
                            List<UUID> recipientIds) {

    /**
     * @throws IllegalArgumentException if a routing field is missing or malformed
     */
    public static EventEnvelope fromJson(JsonNode node) {
        List<UUID> recipients = new ArrayList<>();
        JsonNode recipientNode = node.path("recipientIds");
        if (recipientNode.isArray()) {
            recipientNode.forEach(id -> recipients.add(UUID.fromString(id.asText())));
        }
        return new EventEnvelope(
            UUID.fromString(required(node, "eventId")),
            required(node, "eventType"),
            required(node, "aggregateType"),
            UUID.fromString(required(node, "aggregateId")),
            List.copyOf(recipients)
        );
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Event payload is missing " + field);
        }
        return value.asText();
    }
}
