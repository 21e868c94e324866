package com.flagship.game_economy.shop.requirement;

public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public boolean test(long actual, long threshold) {
        return switch (this) {
            case EQ -> actual == threshold;
            case NE -> actual != threshold;
            case GT -> actual > threshold;
            case GTE -> actual >= threshold;
            case LT -> actual < threshold;
            case LTE -> actual <= threshold;
        };
    }

    public String symbol() {
        return symbol;
    }
}
