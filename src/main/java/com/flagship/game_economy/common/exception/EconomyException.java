package com.flagship.game_economy.common.exception;

/**
 * Base type for all domain failures raised by the economy engine.
 *
 * Every subclass is thrown before the failing operation issues a mutating statement,
 * so the surrounding transaction can simply be rolled back.
 */
public abstract class EconomyException extends RuntimeException {

    private final ErrorCode code;

    protected EconomyException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
