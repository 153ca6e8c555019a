package com.finboard.ledger.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.model.TransactionType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionResponseDto(
        UUID id,
        UUID accountId,
        TransactionType transactionType,
        BigDecimal amount,
        String category,
        String merchant,
        String description,
        List<String> tags,
        Instant transactionDate,
        Instant createdAt,
        Instant updatedAt
) {
    public static TransactionResponseDto from(TransactionEntity transaction) {
        return new TransactionResponseDto(
                transaction.getId(),
                transaction.getAccountId(),
                transaction.getTransactionType(),
                transaction.getAmount().setScale(2, RoundingMode.HALF_UP),
                transaction.getCategory(),
                transaction.getMerchant(),
                transaction.getDescription(),
                transaction.getTagList(),
                transaction.getTransactionDate(),
                transaction.getCreatedAt(),
                transaction.getUpdatedAt()
        );
    }
}
