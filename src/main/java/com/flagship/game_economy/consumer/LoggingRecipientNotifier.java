package com.flagship.game_economy.consumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@Slf4j
public class LoggingRecipientNotifier implements RecipientNotifier {

    @Override
    public void notify(UUID recipientId, String eventType, String payload) {
        log.info("Notify competitor {}: {}", recipientId, eventType);
    }
}
