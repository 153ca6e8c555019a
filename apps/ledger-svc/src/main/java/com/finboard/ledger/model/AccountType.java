package com.finboard.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AccountType {
    CHECKING("checking"),
    SAVINGS("savings"),
    CREDIT_CARD("credit_card"),
    INVESTMENT("investment"),
    CRYPTO("crypto"),
    LOAN("loan"),
    OTHER("other");

    private final String value;

    AccountType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AccountType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("account_type must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AccountType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown account type: " + raw);
    }
}
