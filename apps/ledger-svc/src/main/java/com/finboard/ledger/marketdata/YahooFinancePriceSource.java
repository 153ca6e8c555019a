package com.finboard.ledger.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.finboard.ledger.config.FinboardProperties;
import com.finboard.ledger.model.PriceQuote;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Quote lookups against the Yahoo Finance v7 quote endpoint. Calls block for at most the configured
 * request timeout.
 */
@Component
public class YahooFinancePriceSource implements PriceSource {
    private static final Logger log = LoggerFactory.getLogger(YahooFinancePriceSource.class);

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; finboard-ledger/0.1)";

    private final WebClient webClient;
    private final Duration timeout;

    public YahooFinancePriceSource(FinboardProperties properties) {
        this.timeout = properties.marketData().requestTimeout();
        this.webClient = WebClient.builder()
                .baseUrl(properties.marketData().baseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public QuotePayload fetchQuote(String tickerSymbol) {
        JsonNode quote = firstQuote(tickerSymbol);
        if (quote == null) {
            throw new MarketDataException("No quote returned for " + tickerSymbol);
        }
        return toPayload(quote);
    }

    @Override
    public Optional<PriceQuote> searchTicker(String query) {
        JsonNode quote = firstQuote(query);
        if (quote == null) {
            return Optional.empty();
        }
        QuotePayload payload = toPayload(quote);
        return Optional.of(new PriceQuote(
                query,
                PriceNormalizer.resolveName(payload, query),
                payload.exchange() != null ? payload.exchange() : PriceNormalizer.DEFAULT_EXCHANGE,
                PriceNormalizer.resolvePrice(payload),
                payload.currency(),
                payload.marketCap(),
                payload.sector(),
                payload.industry()
        ));
    }

    private JsonNode firstQuote(String ticker) {
        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/v7/finance/quote").queryParam("symbols", ticker).build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .doOnError(e -> log.debug("Yahoo quote request failed for {}", ticker, e))
                    .block(timeout);
        } catch (RuntimeException ex) {
            throw new MarketDataException("Quote request failed for " + ticker + ": " + ex.getMessage(), ex);
        }
        if (body == null) {
            return null;
        }
        JsonNode result = body.path("quoteResponse").path("result");
        if (!result.isArray() || result.isEmpty()) {
            return null;
        }
        return result.get(0);
    }

    static QuotePayload toPayload(JsonNode quote) {
        BigDecimal previousClose = decimal(quote, "previousClose");
        if (previousClose == null) {
            previousClose = decimal(quote, "regularMarketPreviousClose");
        }
        JsonNode marketCap = quote.get("marketCap");
        return new QuotePayload(
                decimal(quote, "currentPrice"),
                decimal(quote, "regularMarketPrice"),
                previousClose,
                text(quote, "longName"),
                text(quote, "shortName"),
                text(quote, "currency"),
                marketCap != null && marketCap.canConvertToLong() ? marketCap.asLong() : null,
                text(quote, "sector"),
                text(quote, "industry"),
                text(quote, "exchange")
        );
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.decimalValue();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
