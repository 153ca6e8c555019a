package com.finboard.ledger.marketdata;

/**
 * A quote lookup against the external price source failed (transport, parse or empty result).
 * Never surfaced to API callers: the market data layer resolves it to a default value.
 */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
