package com.finboard.ledger.marketdata;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PriceNormalizerTest {

    @Test
    void mapsIndianExchangesToVendorSuffixes() {
        assertThat(PriceNormalizer.tickerSymbol("RELIANCE", "NSE")).isEqualTo("RELIANCE.NS");
        assertThat(PriceNormalizer.tickerSymbol("RELIANCE", "india")).isEqualTo("RELIANCE.NS");
        assertThat(PriceNormalizer.tickerSymbol("TCS", "bse")).isEqualTo("TCS.BO");
    }

    @Test
    void leavesOtherExchangesUntouched() {
        assertThat(PriceNormalizer.tickerSymbol("AAPL", "US")).isEqualTo("AAPL");
        assertThat(PriceNormalizer.tickerSymbol("AAPL", null)).isEqualTo("AAPL");
        assertThat(PriceNormalizer.tickerSymbol("VOD", "LSE")).isEqualTo("VOD");
    }

    @Test
    void priceKeyDefaultsMissingExchangeToUs() {
        assertThat(PriceNormalizer.priceKey("AAPL", null)).isEqualTo("AAPL:US");
        assertThat(PriceNormalizer.priceKey("AAPL", " ")).isEqualTo("AAPL:US");
        assertThat(PriceNormalizer.priceKey("INFY", "NSE")).isEqualTo("INFY:NSE");
    }

    @Test
    void resolvesPriceInPreferenceOrder() {
        assertThat(PriceNormalizer.resolvePrice(payload(new BigDecimal("10"), new BigDecimal("11"), new BigDecimal("12"))))
                .isEqualByComparingTo("10");
        assertThat(PriceNormalizer.resolvePrice(payload(null, new BigDecimal("11"), new BigDecimal("12"))))
                .isEqualByComparingTo("11");
        assertThat(PriceNormalizer.resolvePrice(payload(null, null, new BigDecimal("12"))))
                .isEqualByComparingTo("12");
        assertThat(PriceNormalizer.resolvePrice(payload(null, null, null))).isEqualByComparingTo("0");
        assertThat(PriceNormalizer.resolvePrice(null)).isEqualByComparingTo("0");
    }

    @Test
    void resolvesNameFromLongThenShortThenSymbol() {
        QuotePayload both = new QuotePayload(null, null, null, "Apple Inc.", "Apple", null, null, null, null, null);
        QuotePayload shortOnly = new QuotePayload(null, null, null, " ", "Apple", null, null, null, null, null);
        assertThat(PriceNormalizer.resolveName(both, "AAPL")).isEqualTo("Apple Inc.");
        assertThat(PriceNormalizer.resolveName(shortOnly, "AAPL")).isEqualTo("Apple");
        assertThat(PriceNormalizer.resolveName(payload(null, null, null), "AAPL")).isEqualTo("AAPL");
    }

    private static QuotePayload payload(BigDecimal current, BigDecimal regular, BigDecimal previousClose) {
        return new QuotePayload(current, regular, previousClose, null, null, "USD", null, null, null, null);
    }
}
