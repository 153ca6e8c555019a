package com.finboard.ledger.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.finboard.ledger.model.PriceQuote;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class MarketDataServiceTest {

    @Mock
    private PriceSource priceSource;

    @Mock
    private ConcurrentPriceFetcher priceFetcher;

    private MarketDataService marketDataService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        marketDataService = new MarketDataService(priceSource, priceFetcher);
    }

    @Test
    void currentPriceUsesVendorTickerForExchange() {
        when(priceSource.fetchQuote("INFY.NS")).thenReturn(payload(new BigDecimal("1520.40"), null, "INR"));

        assertThat(marketDataService.currentPrice("INFY", "NSE")).isEqualByComparingTo("1520.40");
        verify(priceSource).fetchQuote("INFY.NS");
    }

    @Test
    void currentPriceFailureDefaultsToZero() {
        when(priceSource.fetchQuote("AAPL")).thenThrow(new MarketDataException("down"));

        assertThat(marketDataService.currentPrice("AAPL", "US")).isEqualByComparingTo("0");
    }

    @Test
    void tickerInfoFallsBackToRegularMarketPrice() {
        when(priceSource.fetchQuote("AAPL")).thenReturn(payload(null, new BigDecimal("188.10"), null));

        PriceQuote info = marketDataService.tickerInfo("AAPL", null);

        assertThat(info.currentPrice()).isEqualByComparingTo("188.10");
        assertThat(info.exchange()).isEqualTo("US");
        assertThat(info.currency()).isEqualTo("USD");
        assertThat(info.name()).isEqualTo("Apple Inc.");
    }

    @Test
    void tickerInfoFailureUsesSymbolAsName() {
        when(priceSource.fetchQuote("TCS.BO")).thenThrow(new MarketDataException("down"));

        PriceQuote info = marketDataService.tickerInfo("TCS", "BSE");

        assertThat(info.name()).isEqualTo("TCS");
        assertThat(info.currentPrice()).isEqualByComparingTo("0");
        assertThat(info.exchange()).isEqualTo("BSE");
    }

    @Test
    void searchFailureReturnsEmptyList() {
        when(priceSource.searchTicker("XYZ")).thenThrow(new MarketDataException("down"));

        assertThat(marketDataService.searchTicker("XYZ")).isEmpty();
    }

    @Test
    void searchHitReturnsSingleResult() {
        PriceQuote quote = new PriceQuote("MSFT", "Microsoft", "US", new BigDecimal("410"), "USD", null, null, null);
        when(priceSource.searchTicker("MSFT")).thenReturn(Optional.of(quote));

        assertThat(marketDataService.searchTicker("MSFT")).isEqualTo(List.of(quote));
    }

    private static QuotePayload payload(BigDecimal current, BigDecimal regular, String currency) {
        return new QuotePayload(current, regular, null, "Apple Inc.", null, currency, null, null, null, null);
    }
}
