package com.finboard.ledger.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.model.AccountType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountResponseDto(
        UUID id,
        String name,
        AccountType accountType,
        BigDecimal balance,
        String currency,
        String institution,
        String accountNumber,
        String notes,
        boolean isActive,
        Instant createdAt,
        Instant updatedAt
) {
    public static AccountResponseDto from(AccountEntity account) {
        BigDecimal balance = account.getBalance() != null ? account.getBalance() : BigDecimal.ZERO;
        return new AccountResponseDto(
                account.getId(),
                account.getName(),
                account.getAccountType(),
                balance.setScale(2, RoundingMode.HALF_UP),
                account.getCurrency(),
                account.getInstitution(),
                account.getAccountNumber(),
                account.getNotes(),
                account.isActive(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }
}
