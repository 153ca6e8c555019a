package com.finboard.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PriceQuote(
        String symbol,
        String name,
        String exchange,
        BigDecimal currentPrice,
        String currency,
        Long marketCap,
        String sector,
        String industry
) {
}
