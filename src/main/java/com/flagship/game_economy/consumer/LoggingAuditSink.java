package com.flagship.game_economy.consumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingAuditSink implements AuditSink {

    @Override
    public void record(EventEnvelope envelope, String payload) {
        log.info("AUDIT {} {}={} event={} payload={}",
                envelope.eventType(), envelope.aggregateType(), envelope.aggregateId(),
                envelope.eventId(), payload);
    }
}
