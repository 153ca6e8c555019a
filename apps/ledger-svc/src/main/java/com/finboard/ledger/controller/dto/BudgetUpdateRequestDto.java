package com.finboard.ledger.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;

public record BudgetUpdateRequestDto(@DecimalMin("0") BigDecimal amount, String period) {
}
