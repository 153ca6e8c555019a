package com.finboard.ledger.marketdata;

import com.finboard.ledger.config.FinboardProperties;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans a batch of price lookups out over the price-fetch pool and joins them. One slow or failing
 * ticker never fails the batch: its key resolves to zero and the failure is logged.
 */
@Component
public class ConcurrentPriceFetcher {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentPriceFetcher.class);

    private final PriceSource priceSource;
    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public ConcurrentPriceFetcher(
            PriceSource priceSource,
            @Qualifier("priceFetchExecutor") Executor executor,
            FinboardProperties properties
    ) {
        this(priceSource, executor, properties.marketData().requestTimeout());
    }

    ConcurrentPriceFetcher(PriceSource priceSource, Executor executor, Duration timeout) {
        this.priceSource = priceSource;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Resolved price per {@code symbol:exchange} key, one entry per distinct key in the input.
     */
    public Map<String, BigDecimal> fetchPrices(List<PriceRequest> requests) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        fetchAll(requests).forEach((key, lookup) -> prices.put(key, lookup.price()));
        return prices;
    }

    public Map<String, PriceLookup> fetchAll(List<PriceRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return Map.of();
        }
        Map<String, PriceRequest> distinct = new LinkedHashMap<>();
        for (PriceRequest request : requests) {
            distinct.put(request.key(), request);
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<PriceLookup>> futures = new ArrayList<>(distinct.size());
        for (PriceRequest request : distinct.values()) {
            futures.add(submit(request, mdc));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, PriceLookup> results = new LinkedHashMap<>();
        int failures = 0;
        for (CompletableFuture<PriceLookup> future : futures) {
            PriceLookup lookup = future.join();
            results.put(lookup.key(), lookup);
            if (!lookup.succeeded()) {
                failures++;
            }
        }
        if (failures > 0) {
            log.info("Price batch completed with {} of {} lookups defaulted to zero", failures, results.size());
        }
        return results;
    }

    private CompletableFuture<PriceLookup> submit(PriceRequest request, Map<String, String> mdc) {
        CompletableFuture<PriceLookup> task = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                // deadline runs from task start, queueing behind a busy pool is free
                task.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    task.complete(withMdc(mdc, () -> lookup(request)));
                } catch (RuntimeException ex) {
                    task.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.completedFuture(failed(request, ex));
        }
        return task.exceptionally(ex -> failed(request, ex));
    }

    private PriceLookup lookup(PriceRequest request) {
        String ticker = PriceNormalizer.tickerSymbol(request.symbol(), request.exchange());
        QuotePayload payload = priceSource.fetchQuote(ticker);
        return PriceLookup.success(request.key(), PriceNormalizer.resolvePrice(payload));
    }

    private PriceLookup failed(PriceRequest request, Throwable error) {
        Throwable cause = unwrap(error);
        String reason = cause instanceof TimeoutException
                ? "timed out after " + timeout.toMillis() + " ms"
                : String.valueOf(cause.getMessage());
        log.warn("Price lookup failed for {}: {}", request.key(), reason);
        return PriceLookup.failed(request.key(), reason);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> T withMdc(Map<String, String> mdc, Supplier<T> work) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return work.get();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
