package com.finboard.ledger.budget;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finboard.ledger.entity.BudgetEntity;
import com.finboard.ledger.model.HoldingValuation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BudgetView(
        UUID id,
        String category,
        BigDecimal amount,
        String period,
        BigDecimal spent,
        BigDecimal remaining,
        BigDecimal percentageUsed,
        Instant createdAt,
        Instant updatedAt
) {

    public static BudgetView of(BudgetEntity budget) {
        BigDecimal amount = budget.getAmount().setScale(2, RoundingMode.HALF_UP);
        BigDecimal spent = (budget.getSpent() != null ? budget.getSpent() : BigDecimal.ZERO)
                .setScale(2, RoundingMode.HALF_UP);
        return new BudgetView(
                budget.getId(),
                budget.getCategory(),
                amount,
                budget.getPeriod(),
                spent,
                amount.subtract(spent),
                HoldingValuation.percentageOf(spent, amount),
                budget.getCreatedAt(),
                budget.getUpdatedAt()
        );
    }
}
