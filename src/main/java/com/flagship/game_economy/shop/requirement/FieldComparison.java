package com.flagship.game_economy.shop.requirement;

import java.util.Objects;

public record FieldComparison(RequirementField field, ComparisonOperator operator, long threshold)
        implements PurchaseRequirement {

    public FieldComparison {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
    }

    @Override
    public boolean isSatisfiedBy(PurchaseContext context) {
        return operator.test(field.valueIn(context), threshold);
    }

    @Override
    public String describe() {
        return field + " " + operator.symbol() + " " + threshold;
    }
}
