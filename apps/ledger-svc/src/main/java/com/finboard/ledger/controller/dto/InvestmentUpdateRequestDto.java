package com.finboard.ledger.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InvestmentUpdateRequestDto(
        @DecimalMin(value = "0", inclusive = false) BigDecimal quantity,
        @DecimalMin("0") BigDecimal purchasePrice,
        String name
) {
}
