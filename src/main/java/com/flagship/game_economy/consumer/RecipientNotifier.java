package com.flagship.game_economy.consumer;

import java.util.UUID;

/**
 * Real-time delivery to a connected competitor (WebSocket fan-out lives behind this).
 */
public interface RecipientNotifier {

    void notify(UUID recipientId, String eventType, String payload);
}
