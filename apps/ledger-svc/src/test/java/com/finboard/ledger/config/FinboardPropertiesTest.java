package com.finboard.ledger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class FinboardPropertiesTest {

    @Test
    void marketDataDefaultsTimeoutAndConcurrency() {
        var marketData = new FinboardProperties.MarketData("https://query1.finance.yahoo.com", null, null);

        assertThat(marketData.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(marketData.maxConcurrency()).isEqualTo(8);
    }

    @Test
    void marketDataRequiresBaseUrl() {
        assertThatThrownBy(() -> new FinboardProperties.MarketData(" ", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baseUrl");
    }

    @Test
    void marketDataRejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new FinboardProperties.MarketData("http://x", Duration.ZERO, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FinboardProperties.MarketData("http://x", Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyticsZoneDefaultsToUtc() {
        var properties = new FinboardProperties(new FinboardProperties.MarketData("http://x", null, null), null);

        assertThat(properties.analytics().zoneId()).isEqualTo(ZoneId.of("UTC"));
        assertThat(new FinboardProperties.Analytics("Asia/Kolkata").zoneId()).isEqualTo(ZoneId.of("Asia/Kolkata"));
    }

    @Test
    void marketDataSectionIsRequired() {
        assertThatThrownBy(() -> new FinboardProperties(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
