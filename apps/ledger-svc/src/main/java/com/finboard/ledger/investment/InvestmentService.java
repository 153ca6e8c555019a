package com.finboard.ledger.investment;

import com.finboard.ledger.entity.InvestmentEntity;
import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.marketdata.MarketDataService;
import com.finboard.ledger.marketdata.PriceNormalizer;
import com.finboard.ledger.model.HoldingValuation;
import com.finboard.ledger.model.PortfolioSummary;
import com.finboard.ledger.model.PriceQuote;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaInvestmentRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class InvestmentService {

    private static final String DEFAULT_CURRENCY = "USD";

    private final JpaInvestmentRepository investmentRepository;
    private final JpaAccountRepository accountRepository;
    private final PortfolioValuator portfolioValuator;
    private final MarketDataService marketDataService;
    private final Clock clock;

    public InvestmentService(
            JpaInvestmentRepository investmentRepository,
            JpaAccountRepository accountRepository,
            PortfolioValuator portfolioValuator,
            MarketDataService marketDataService,
            Clock clock
    ) {
        this.investmentRepository = investmentRepository;
        this.accountRepository = accountRepository;
        this.portfolioValuator = portfolioValuator;
        this.marketDataService = marketDataService;
        this.clock = clock;
    }

    public List<InvestmentView> listInvestments(Optional<UUID> accountId) {
        List<InvestmentEntity> holdings = accountId
                .map(investmentRepository::findByAccountId)
                .orElseGet(investmentRepository::findAll);
        List<HoldingValuation> valuations = portfolioValuator.valuate(holdings);
        List<InvestmentView> views = new ArrayList<>(holdings.size());
        for (int i = 0; i < holdings.size(); i++) {
            views.add(InvestmentView.of(holdings.get(i), valuations.get(i)));
        }
        return views;
    }

    public InvestmentView getInvestment(UUID investmentId) {
        InvestmentEntity investment = requireInvestment(investmentId);
        return InvestmentView.of(investment, portfolioValuator.refresh(investment));
    }

    public InvestmentView refreshPrice(UUID investmentId) {
        return getInvestment(investmentId);
    }

    /**
     * Creates a holding, resolving its display name (when none is given) and its initial price from
     * market data. Lookup failures fall back to the symbol as name and a zero price.
     */
    public InvestmentView createInvestment(NewInvestment request) {
        InvestmentEntity investment = newEntity(request);
        if (investment.getName() == null || investment.getName().isBlank()) {
            PriceQuote info = marketDataService.tickerInfo(investment.getSymbol(), investment.getExchange());
            investment.setName(info.name());
        }
        investment.setCurrentPrice(marketDataService.currentPrice(investment.getSymbol(), investment.getExchange()));
        InvestmentEntity saved = investmentRepository.save(investment);
        return InvestmentView.of(saved, PortfolioValuator.valuationOf(saved));
    }

    /**
     * Stores a holding as given, without market data lookups; prices fill in on the next read.
     */
    public InvestmentEntity importInvestment(NewInvestment request) {
        InvestmentEntity investment = newEntity(request);
        if (investment.getName() == null || investment.getName().isBlank()) {
            investment.setName(investment.getSymbol());
        }
        return investmentRepository.save(investment);
    }

    public InvestmentView updateInvestment(UUID investmentId, Optional<BigDecimal> quantity,
                                           Optional<BigDecimal> purchasePrice, Optional<String> name) {
        InvestmentEntity investment = requireInvestment(investmentId);
        quantity.ifPresent(value -> {
            requirePositive(value, "quantity");
            investment.setQuantity(value);
        });
        purchasePrice.ifPresent(value -> {
            requireNonNegative(value, "purchase_price");
            investment.setPurchasePrice(value);
        });
        name.ifPresent(investment::setName);
        investment.setUpdatedAt(clock.instant());
        InvestmentEntity saved = investmentRepository.save(investment);
        return InvestmentView.of(saved, PortfolioValuator.valuationOf(saved));
    }

    public void deleteInvestment(UUID investmentId) {
        investmentRepository.delete(requireInvestment(investmentId));
    }

    public PortfolioSummary portfolioSummary() {
        return portfolioValuator.portfolioSummary(investmentRepository.findAll());
    }

    public List<PriceQuote> searchTicker(String query) {
        return marketDataService.searchTicker(query);
    }

    private InvestmentEntity newEntity(NewInvestment request) {
        if (request.accountId() == null || !accountRepository.existsById(request.accountId())) {
            throw NotFoundException.of("Account");
        }
        if (request.symbol() == null || request.symbol().isBlank()) {
            throw new ValidationException("symbol must be provided");
        }
        if (request.assetType() == null || request.assetType().isBlank()) {
            throw new ValidationException("asset_type must be provided");
        }
        requirePositive(request.quantity(), "quantity");
        requireNonNegative(request.purchasePrice(), "purchase_price");
        InvestmentEntity investment = new InvestmentEntity(
                UUID.randomUUID(),
                request.accountId(),
                request.symbol().trim().toUpperCase(Locale.ROOT),
                request.assetType().trim().toLowerCase(Locale.ROOT),
                PriceNormalizer.normalizeExchange(request.exchange()).trim().toUpperCase(Locale.ROOT),
                request.quantity(),
                request.purchasePrice(),
                request.currency() == null || request.currency().isBlank() ? DEFAULT_CURRENCY : request.currency(),
                clock.instant()
        );
        investment.setName(request.name());
        investment.setPurchaseDate(request.purchaseDate());
        return investment;
    }

    private InvestmentEntity requireInvestment(UUID investmentId) {
        return investmentRepository.findById(investmentId)
                .orElseThrow(() -> NotFoundException.of("Investment"));
    }

    private static void requirePositive(BigDecimal value, String field) {
        if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        if (value == null || value.compareTo(BigDecimal.ZERO) < 0) {
            throw new ValidationException(field + " must not be negative");
        }
    }

    public record NewInvestment(
            UUID accountId,
            String symbol,
            String name,
            String assetType,
            String exchange,
            BigDecimal quantity,
            BigDecimal purchasePrice,
            String currency,
            Instant purchaseDate
    ) {
    }
}
