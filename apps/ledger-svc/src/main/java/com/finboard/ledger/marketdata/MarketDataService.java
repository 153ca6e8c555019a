package com.finboard.ledger.marketdata;

import com.finboard.ledger.model.PriceQuote;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for market data: single lookups, ticker info, search and batched prices. Vendor
 * failures are absorbed here and replaced by defaults (zero price, symbol as name).
 */
@Service
public class MarketDataService {
    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private static final String DEFAULT_CURRENCY = "USD";

    private final PriceSource priceSource;
    private final ConcurrentPriceFetcher priceFetcher;

    public MarketDataService(PriceSource priceSource, ConcurrentPriceFetcher priceFetcher) {
        this.priceSource = priceSource;
        this.priceFetcher = priceFetcher;
    }

    public BigDecimal currentPrice(String symbol, String exchange) {
        String ticker = PriceNormalizer.tickerSymbol(symbol, exchange);
        try {
            return PriceNormalizer.resolvePrice(priceSource.fetchQuote(ticker));
        } catch (RuntimeException ex) {
            log.warn("Price lookup failed for {}: {}", ticker, ex.getMessage());
            return BigDecimal.ZERO;
        }
    }

    public Map<String, BigDecimal> currentPrices(List<PriceRequest> requests) {
        return priceFetcher.fetchPrices(requests);
    }

    public PriceQuote tickerInfo(String symbol, String exchange) {
        String ticker = PriceNormalizer.tickerSymbol(symbol, exchange);
        String normalizedExchange = PriceNormalizer.normalizeExchange(exchange);
        try {
            QuotePayload payload = priceSource.fetchQuote(ticker);
            BigDecimal price = payload.currentPrice() != null ? payload.currentPrice()
                    : payload.regularMarketPrice() != null ? payload.regularMarketPrice()
                    : BigDecimal.ZERO;
            return new PriceQuote(
                    symbol,
                    PriceNormalizer.resolveName(payload, symbol),
                    normalizedExchange,
                    price,
                    payload.currency() != null ? payload.currency() : DEFAULT_CURRENCY,
                    payload.marketCap(),
                    payload.sector(),
                    payload.industry()
            );
        } catch (RuntimeException ex) {
            log.warn("Ticker info lookup failed for {}: {}", ticker, ex.getMessage());
            return new PriceQuote(symbol, symbol, normalizedExchange, BigDecimal.ZERO, DEFAULT_CURRENCY,
                    null, null, null);
        }
    }

    public List<PriceQuote> searchTicker(String query) {
        try {
            return priceSource.searchTicker(query).map(List::of).orElse(List.of());
        } catch (RuntimeException ex) {
            log.warn("Ticker search failed for {}: {}", query, ex.getMessage());
            return List.of();
        }
    }
}
