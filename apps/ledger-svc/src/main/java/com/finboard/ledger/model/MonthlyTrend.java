package com.finboard.ledger.model;

import java.math.BigDecimal;
import java.util.List;

public record MonthlyTrend(List<MonthPoint> trend, int months) {

    public record MonthPoint(String month, BigDecimal income, BigDecimal expenses, BigDecimal net) {
    }
}
