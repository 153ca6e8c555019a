package com.finboard.ledger.model;

import java.math.BigDecimal;
import java.util.UUID;

public record AccountBalance(UUID id, String name, AccountType type, BigDecimal balance, String currency) {
}
