package com.finboard.ledger.marketdata;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Maps (symbol, exchange) pairs onto vendor tickers and pulls prices and names out of quote payloads.
 */
public final class PriceNormalizer {

    public static final String DEFAULT_EXCHANGE = "US";

    private PriceNormalizer() {
    }

    public static String tickerSymbol(String symbol, String exchange) {
        if (exchange == null) {
            return symbol;
        }
        return switch (exchange.trim().toUpperCase(Locale.ROOT)) {
            case "NSE", "INDIA" -> symbol + ".NS";
            case "BSE" -> symbol + ".BO";
            default -> symbol;
        };
    }

    public static String priceKey(String symbol, String exchange) {
        return symbol + ":" + normalizeExchange(exchange);
    }

    public static String normalizeExchange(String exchange) {
        return exchange == null || exchange.isBlank() ? DEFAULT_EXCHANGE : exchange;
    }

    /**
     * First present of currentPrice, regularMarketPrice and previousClose; zero when none is.
     */
    public static BigDecimal resolvePrice(QuotePayload payload) {
        if (payload == null) {
            return BigDecimal.ZERO;
        }
        if (payload.currentPrice() != null) {
            return payload.currentPrice();
        }
        if (payload.regularMarketPrice() != null) {
            return payload.regularMarketPrice();
        }
        if (payload.previousClose() != null) {
            return payload.previousClose();
        }
        return BigDecimal.ZERO;
    }

    public static String resolveName(QuotePayload payload, String fallbackSymbol) {
        if (payload == null) {
            return fallbackSymbol;
        }
        if (payload.longName() != null && !payload.longName().isBlank()) {
            return payload.longName();
        }
        if (payload.shortName() != null && !payload.shortName().isBlank()) {
            return payload.shortName();
        }
        return fallbackSymbol;
    }
}
