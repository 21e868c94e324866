package com.flagship.game_economy.ledger;

/**
 * Why currency moved. Stored on every {@link CurrencyTransaction}.
 */
public enum TransactionType {
    /** Peer-to-peer transfer between two competitors. */
    TRANSFER,
    /** Currency spent on a shop item or battle pass (burned). */
    PURCHASE,
    /** Currency minted by the system (tier rewards, daily rewards, opening balances). */
    REWARD,
    /** Currency leg of a settled trade. */
    TRADE
}
