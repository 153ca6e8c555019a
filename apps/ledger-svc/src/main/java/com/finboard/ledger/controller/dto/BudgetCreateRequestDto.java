package com.finboard.ledger.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BudgetCreateRequestDto(
        @NotBlank String category,
        @NotNull @DecimalMin("0") BigDecimal amount,
        String period
) {
}
