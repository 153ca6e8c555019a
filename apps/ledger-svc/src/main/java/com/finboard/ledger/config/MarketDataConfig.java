package com.finboard.ledger.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MarketDataConfig {

    /**
     * Worker pool for price lookups. Its size caps how many quote requests are in flight at once
     * across all concurrent valuation calls.
     */
    @Bean(name = "priceFetchExecutor", destroyMethod = "shutdown")
    public ExecutorService priceFetchExecutor(FinboardProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "price-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.marketData().maxConcurrency(), threadFactory);
    }

    @Bean
    public Clock clock(FinboardProperties properties) {
        return Clock.system(properties.analytics().zoneId());
    }
}
