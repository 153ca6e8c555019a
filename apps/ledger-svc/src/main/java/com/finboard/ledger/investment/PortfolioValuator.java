package com.finboard.ledger.investment;

import com.finboard.ledger.entity.InvestmentEntity;
import com.finboard.ledger.marketdata.MarketDataService;
import com.finboard.ledger.marketdata.PriceNormalizer;
import com.finboard.ledger.marketdata.PriceRequest;
import com.finboard.ledger.model.HoldingValuation;
import com.finboard.ledger.model.PortfolioSummary;
import com.finboard.ledger.repository.JpaInvestmentRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Values holdings against live prices. Valuation refreshes each holding's cached current price as a
 * side effect; holdings whose price could not be fetched keep reporting the value the batch returned.
 */
@Component
public class PortfolioValuator {
    private static final Logger log = LoggerFactory.getLogger(PortfolioValuator.class);

    private final MarketDataService marketDataService;
    private final JpaInvestmentRepository investmentRepository;

    public PortfolioValuator(MarketDataService marketDataService, JpaInvestmentRepository investmentRepository) {
        this.marketDataService = marketDataService;
        this.investmentRepository = investmentRepository;
    }

    /**
     * Fetches prices for all distinct (symbol, exchange) pairs in one concurrent batch, caches them on
     * the holdings and returns a valuation per holding in input order.
     */
    public List<HoldingValuation> valuate(List<InvestmentEntity> holdings) {
        if (holdings.isEmpty()) {
            return List.of();
        }
        List<PriceRequest> requests = holdings.stream()
                .map(holding -> new PriceRequest(holding.getSymbol(), holding.getExchange()))
                .distinct()
                .toList();
        Map<String, BigDecimal> prices = marketDataService.currentPrices(requests);

        List<HoldingValuation> valuations = new ArrayList<>(holdings.size());
        for (InvestmentEntity holding : holdings) {
            String key = PriceNormalizer.priceKey(holding.getSymbol(), holding.getExchange());
            BigDecimal price = prices.get(key);
            if (price == null) {
                price = holding.getCurrentPrice();
            }
            cacheCurrentPrice(holding, price);
            valuations.add(valuationOf(holding));
        }
        return valuations;
    }

    /**
     * Single-holding refresh using one direct lookup.
     */
    public HoldingValuation refresh(InvestmentEntity holding) {
        BigDecimal price = marketDataService.currentPrice(holding.getSymbol(), holding.getExchange());
        cacheCurrentPrice(holding, price);
        return valuationOf(holding);
    }

    public PortfolioSummary portfolioSummary(List<InvestmentEntity> holdings) {
        if (holdings.isEmpty()) {
            return PortfolioSummary.empty();
        }
        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;
        for (HoldingValuation valuation : valuate(holdings)) {
            totalValue = totalValue.add(valuation.currentValue());
            totalCost = totalCost.add(valuation.costBasis());
        }
        BigDecimal value = totalValue.setScale(2, RoundingMode.HALF_UP);
        BigDecimal cost = totalCost.setScale(2, RoundingMode.HALF_UP);
        return new PortfolioSummary(
                value,
                cost,
                value.subtract(cost),
                HoldingValuation.percentageOf(totalValue.subtract(totalCost), totalCost),
                holdings.size()
        );
    }

    public static HoldingValuation valuationOf(InvestmentEntity holding) {
        return HoldingValuation.of(
                holding.getId(),
                holding.getSymbol(),
                holding.getExchange(),
                holding.getQuantity(),
                holding.getPurchasePrice(),
                holding.getCurrentPrice()
        );
    }

    private void cacheCurrentPrice(InvestmentEntity holding, BigDecimal price) {
        BigDecimal resolved = price != null ? price : BigDecimal.ZERO;
        holding.setCurrentPrice(resolved);
        if (holding.getId() == null) {
            return;
        }
        if (investmentRepository.updateCurrentPrice(holding.getId(), resolved) == 0) {
            log.debug("Discarded price write-back for investment {} (no longer exists)", holding.getId());
        }
    }
}
