package com.finboard.ledger.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finboard.ledger.model.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountCreateRequestDto(
        @NotBlank @Size(max = 255) String name,
        @NotNull AccountType accountType,
        BigDecimal balance,
        @Size(max = 3) String currency,
        String institution,
        String accountNumber,
        String notes
) {
}
