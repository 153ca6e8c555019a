package com.finboard.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

public record HoldingValuation(
        UUID investmentId,
        String symbol,
        String exchange,
        BigDecimal quantity,
        BigDecimal purchasePrice,
        BigDecimal currentPrice,
        BigDecimal costBasis,
        BigDecimal currentValue,
        BigDecimal gainLoss,
        BigDecimal gainLossPercentage
) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static HoldingValuation of(UUID investmentId, String symbol, String exchange,
                                      BigDecimal quantity, BigDecimal purchasePrice, BigDecimal currentPrice) {
        BigDecimal price = currentPrice != null ? currentPrice : BigDecimal.ZERO;
        BigDecimal costBasis = quantity.multiply(purchasePrice);
        BigDecimal currentValue = quantity.multiply(price);
        BigDecimal gainLoss = currentValue.subtract(costBasis);
        return new HoldingValuation(
                investmentId,
                symbol,
                exchange,
                quantity,
                purchasePrice,
                price,
                costBasis,
                currentValue,
                gainLoss,
                percentageOf(gainLoss, costBasis)
        );
    }

    /**
     * {@code part / whole * 100}, or zero when the whole is not positive.
     */
    public static BigDecimal percentageOf(BigDecimal part, BigDecimal whole) {
        if (whole.compareTo(BigDecimal.ZERO) <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return part.multiply(HUNDRED).divide(whole, 2, RoundingMode.HALF_UP);
    }
}
