package com.finboard.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardSummary(
        NetWorth netWorth,
        CashFlow currentMonthCashFlow,
        CategorySpending currentMonthSpending,
        long accountCount,
        long currentMonthTransactionCount,
        Instant timestamp
) {
}
