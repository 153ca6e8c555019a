package com.finboard.ledger.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountUpdateRequestDto(
        @Size(max = 255) String name,
        BigDecimal balance,
        String institution,
        String accountNumber,
        String notes,
        Boolean isActive
) {
}
