package com.flagship.game_economy.consumer;

/**
 * Append-only audit trail of economy events. Storage is owned by the audit service.
 */
public interface AuditSink {

    void record(EventEnvelope envelope, String payload);
}
