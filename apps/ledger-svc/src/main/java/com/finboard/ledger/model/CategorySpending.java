package com.finboard.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategorySpending(
        List<CategoryAmount> categories,
        BigDecimal totalSpending,
        Instant startDate,
        Instant endDate
) {

    public record CategoryAmount(String category, BigDecimal amount, BigDecimal percentage) {
    }
}
