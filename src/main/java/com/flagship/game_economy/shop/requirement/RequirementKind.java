package com.flagship.game_economy.shop.requirement;

public enum RequirementKind {
    FIELD_COMPARISON,
    RANGE_CHECK
}
