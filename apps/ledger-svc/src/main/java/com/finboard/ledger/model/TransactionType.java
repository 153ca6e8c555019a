package com.finboard.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.util.Locale;

public enum TransactionType {
    INCOME("income"),
    EXPENSE("expense"),
    TRANSFER("transfer");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Signed effect of a transaction of this type on its account balance.
     */
    public BigDecimal balanceEffect(BigDecimal amount) {
        return switch (this) {
            case INCOME -> amount;
            case EXPENSE -> amount.negate();
            case TRANSFER -> BigDecimal.ZERO;
        };
    }

    @JsonCreator
    public static TransactionType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("transaction_type must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + raw);
    }
}
