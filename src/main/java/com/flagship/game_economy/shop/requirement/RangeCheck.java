package com.flagship.game_economy.shop.requirement;

import java.util.Objects;

/**
 * Inclusive on both ends.
 */
public record RangeCheck(RequirementField field, long min, long max) implements PurchaseRequirement {

    public RangeCheck {
        Objects.requireNonNull(field, "field");
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " is greater than max " + max);
        }
    }

    @Override
    public boolean isSatisfiedBy(PurchaseContext context) {
        long value = field.valueIn(context);
        return value >= min && value <= max;
    }

    @Override
    public String describe() {
        return field + " in [" + min + ", " + max + "]";
    }
}
