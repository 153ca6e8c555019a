package com.finboard.ledger.marketdata;

import com.finboard.ledger.model.PriceQuote;
import java.util.Optional;

/**
 * Blocking lookup against an external market data vendor. Implementations may throw
 * {@link MarketDataException} at any time.
 */
public interface PriceSource {

    QuotePayload fetchQuote(String tickerSymbol);

    Optional<PriceQuote> searchTicker(String query);
}
