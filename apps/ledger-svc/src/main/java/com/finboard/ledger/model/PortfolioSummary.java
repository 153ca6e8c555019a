package com.finboard.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.math.RoundingMode;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PortfolioSummary(
        BigDecimal totalValue,
        BigDecimal totalCost,
        BigDecimal totalGainLoss,
        BigDecimal totalGainLossPercentage,
        int holdingsCount
) {

    public static PortfolioSummary empty() {
        BigDecimal zero = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        return new PortfolioSummary(zero, zero, zero, zero, 0);
    }
}
