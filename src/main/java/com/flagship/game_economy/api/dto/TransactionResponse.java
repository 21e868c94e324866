package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.ledger.CurrencyTransaction;
import com.flagship.game_economy.ledger.TransactionStatus;
import com.flagship.game_economy.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_competitor_id")
    UUID fromCompetitorId;

    @JsonProperty("to_competitor_id")
    UUID toCompetitorId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(CurrencyTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .fromCompetitorId(transaction.getFromCompetitorId())
            .toCompetitorId(transaction.getToCompetitorId())
            .amount(transaction.getAmount())
            .reason(transaction.getReason())
            .status(transaction.getStatus())
            .type(transaction.getType())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
