package com.finboard.ledger.marketdata;

public record PriceRequest(String symbol, String exchange) {

    public String key() {
        return PriceNormalizer.priceKey(symbol, exchange);
    }
}
