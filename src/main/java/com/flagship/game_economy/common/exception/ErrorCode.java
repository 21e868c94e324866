package com.flagship.game_economy.common.exception;

/**
 * Stable error codes returned to clients in the {@code error.code} field.
 * Codes are part of the API contract; never rename one.
 */
public enum ErrorCode {
    INSUFFICIENT_FUNDS,
    RECIPIENT_NOT_FOUND,
    INSUFFICIENT_QUANTITY,
    INVALID_TRADE,
    TRADE_NOT_FOUND,
    TIER_NOT_REACHED,
    TIER_NOT_FOUND,
    SEASON_NOT_FOUND,
    BATTLE_PASS_REQUIRED,
    ALREADY_CLAIMED,
    ALREADY_PURCHASED,
    BALANCE_NOT_FOUND,
    ITEM_NOT_FOUND,
    ITEM_NOT_AVAILABLE,
    OUT_OF_STOCK,
    REQUIREMENT_NOT_MET,
    INVALID_REQUEST
}
