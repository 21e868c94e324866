package com.flagship.game_economy.shop.requirement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.util.UUID;

@Entity
@Immutable
@Table(name = "shop_item_requirements")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ShopItemRequirementEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private RequirementKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "field", nullable = false, length = 30)
    private RequirementField field;

    @Enumerated(EnumType.STRING)
    @Column(name = "operator", length = 10)
    private ComparisonOperator operator;

    @Column(name = "threshold")
    private Long threshold;

    @Column(name = "min_value")
    private Long minValue;

    @Column(name = "max_value")
    private Long maxValue;

    /**
     * @throws IllegalStateException if the row lacks the columns its kind needs
     */
    public PurchaseRequirement toRequirement() {
        return switch (kind) {
            case FIELD_COMPARISON -> {
                if (operator == null || threshold == null) {
                    throw new IllegalStateException("Requirement " + id + " needs an operator and a threshold");
                }
                yield new FieldComparison(field, operator, threshold);
            }
            case RANGE_CHECK -> {
                if (minValue == null || maxValue == null) {
                    throw new IllegalStateException("Requirement " + id + " needs min_value and max_value");
                }
                yield new RangeCheck(field, minValue, maxValue);
            }
        };
    }
}
