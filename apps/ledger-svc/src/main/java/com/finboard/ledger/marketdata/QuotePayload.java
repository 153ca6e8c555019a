package com.finboard.ledger.marketdata;

import java.math.BigDecimal;

/**
 * Vendor quote fields the service understands. Every field is optional.
 */
public record QuotePayload(
        BigDecimal currentPrice,
        BigDecimal regularMarketPrice,
        BigDecimal previousClose,
        String longName,
        String shortName,
        String currency,
        Long marketCap,
        String sector,
        String industry,
        String exchange
) {
}
