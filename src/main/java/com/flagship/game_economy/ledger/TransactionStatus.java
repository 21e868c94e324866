package com.flagship.game_economy.ledger;

public enum TransactionStatus {
    COMPLETED,
    FAILED
}
