package com.finboard.ledger.investment;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finboard.ledger.entity.InvestmentEntity;
import com.finboard.ledger.model.HoldingValuation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InvestmentView(
        UUID id,
        UUID accountId,
        String symbol,
        String name,
        String assetType,
        String exchange,
        BigDecimal quantity,
        BigDecimal purchasePrice,
        BigDecimal currentPrice,
        String currency,
        BigDecimal costBasis,
        BigDecimal currentValue,
        BigDecimal gainLoss,
        BigDecimal gainLossPercentage,
        Instant purchaseDate,
        Instant createdAt,
        Instant updatedAt
) {

    public static InvestmentView of(InvestmentEntity investment, HoldingValuation valuation) {
        return new InvestmentView(
                investment.getId(),
                investment.getAccountId(),
                investment.getSymbol(),
                investment.getName(),
                investment.getAssetType(),
                investment.getExchange(),
                investment.getQuantity(),
                investment.getPurchasePrice(),
                valuation.currentPrice(),
                investment.getCurrency(),
                money(valuation.costBasis()),
                money(valuation.currentValue()),
                money(valuation.gainLoss()),
                valuation.gainLossPercentage(),
                investment.getPurchaseDate(),
                investment.getCreatedAt(),
                investment.getUpdatedAt()
        );
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
