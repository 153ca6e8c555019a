package com.finboard.ledger.marketdata;

import java.math.BigDecimal;

/**
 * Outcome of one price lookup. Failed lookups carry the default price of zero so callers that only
 * need a number can ignore the status.
 */
public record PriceLookup(String key, Status status, BigDecimal price, String failureReason) {

    public enum Status {
        SUCCESS,
        FAILED
    }

    public static PriceLookup success(String key, BigDecimal price) {
        return new PriceLookup(key, Status.SUCCESS, price, null);
    }

    public static PriceLookup failed(String key, String reason) {
        return new PriceLookup(key, Status.FAILED, BigDecimal.ZERO, reason);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
