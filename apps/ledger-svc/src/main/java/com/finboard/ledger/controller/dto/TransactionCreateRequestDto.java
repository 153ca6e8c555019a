package com.finboard.ledger.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finboard.ledger.model.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * {@code transaction_date} is ISO-8601; a value without offset is read in the configured zone.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionCreateRequestDto(
        @NotNull UUID accountId,
        @NotNull TransactionType transactionType,
        @NotNull @DecimalMin("0") BigDecimal amount,
        String category,
        String merchant,
        String description,
        List<String> tags,
        @NotBlank String transactionDate
) {
}
