package com.finboard.ledger.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "finboard")
public record FinboardProperties(
        MarketData marketData,
        Analytics analytics
) {

    @ConstructorBinding
    public FinboardProperties {
        if (marketData == null) {
            throw new IllegalArgumentException("marketData configuration must be provided");
        }
        // analytics may be omitted; calendar windows then default to UTC
    }

    public Analytics analytics() {
        return analytics != null ? analytics : new Analytics(null);
    }

    public record MarketData(String baseUrl, Duration requestTimeout, Integer maxConcurrency) {
        public MarketData {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must be provided");
            }
            if (requestTimeout == null) {
                requestTimeout = Duration.ofSeconds(5);
            }
            if (requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            if (maxConcurrency == null) {
                maxConcurrency = 8;
            }
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive");
            }
        }
    }

    public record Analytics(String zone) {
        public ZoneId zoneId() {
            return (zone != null && !zone.isBlank()) ? ZoneId.of(zone) : ZoneId.of("UTC");
        }
    }
}
