package com.finboard.ledger.analytics;

import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.investment.PortfolioValuator;
import com.finboard.ledger.model.AccountBalance;
import com.finboard.ledger.model.AccountType;
import com.finboard.ledger.model.CashFlow;
import com.finboard.ledger.model.CategorySpending;
import com.finboard.ledger.model.DashboardSummary;
import com.finboard.ledger.model.HoldingValuation;
import com.finboard.ledger.model.MonthlyTrend;
import com.finboard.ledger.model.NetWorth;
import com.finboard.ledger.model.PortfolioSummary;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaInvestmentRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Derives net worth, cash flow, category spending and monthly trends from ledger rows.
 */
@Service
public class AggregationEngine {

    static final int MIN_TREND_MONTHS = 1;
    static final int MAX_TREND_MONTHS = 24;
    // the trend window approximates a month as 30 days
    static final int DAYS_PER_TREND_MONTH = 30;
    static final Duration DEFAULT_WINDOW = Duration.ofDays(30);

    private final JpaAccountRepository accountRepository;
    private final JpaTransactionRepository transactionRepository;
    private final JpaInvestmentRepository investmentRepository;
    private final PortfolioValuator portfolioValuator;
    private final Clock clock;

    public AggregationEngine(
            JpaAccountRepository accountRepository,
            JpaTransactionRepository transactionRepository,
            JpaInvestmentRepository investmentRepository,
            PortfolioValuator portfolioValuator,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.investmentRepository = investmentRepository;
        this.portfolioValuator = portfolioValuator;
        this.clock = clock;
    }

    public NetWorth netWorth() {
        return netWorth(clock.instant());
    }

    /**
     * Balances of every account, active or not, classified by account type, plus the live value of
     * every investment holding.
     */
    public NetWorth netWorth(Instant now) {
        BigDecimal assets = BigDecimal.ZERO;
        BigDecimal liabilities = BigDecimal.ZERO;
        for (AccountEntity account : accountRepository.findAll()) {
            BigDecimal balance = account.getBalance() != null ? account.getBalance() : BigDecimal.ZERO;
            switch (sideOf(account.getAccountType())) {
                case ASSET -> assets = assets.add(balance);
                case LIABILITY -> liabilities = liabilities.add(balance.abs());
                case EXCLUDED -> {
                }
            }
        }
        PortfolioSummary portfolio = portfolioValuator.portfolioSummary(investmentRepository.findAll());
        BigDecimal totalAssets = money(assets).add(portfolio.totalValue());
        BigDecimal totalLiabilities = money(liabilities);
        return new NetWorth(totalAssets.subtract(totalLiabilities), totalAssets, totalLiabilities, now);
    }

    static BalanceSheetSide sideOf(AccountType type) {
        return switch (type) {
            case CHECKING, SAVINGS, INVESTMENT, CRYPTO -> BalanceSheetSide.ASSET;
            case CREDIT_CARD, LOAN -> BalanceSheetSide.LIABILITY;
            case OTHER -> BalanceSheetSide.EXCLUDED;
        };
    }

    /**
     * Income and expense totals for {@code [start, end]}; a missing start defaults to 30 days ago and a
     * missing end to now.
     */
    public CashFlow cashFlow(Instant start, Instant end) {
        Instant now = clock.instant();
        Instant from = start != null ? start : now.minus(DEFAULT_WINDOW);
        Instant to = end != null ? end : now;
        List<TransactionEntity> transactions = transactionsBetween(from, to);
        BigDecimal income = money(sumOf(transactions, TransactionType.INCOME));
        BigDecimal expenses = money(sumOf(transactions, TransactionType.EXPENSE));
        return new CashFlow(income, expenses, income.subtract(expenses), from, to);
    }

    public CategorySpending spendingByCategory(Instant start, Instant end) {
        Instant now = clock.instant();
        Instant from = start != null ? start : now.minus(DEFAULT_WINDOW);
        Instant to = end != null ? end : now;
        Map<String, BigDecimal> byCategory = transactionsBetween(from, to).stream()
                .filter(tx -> tx.getTransactionType() == TransactionType.EXPENSE)
                .filter(tx -> tx.getCategory() != null)
                .collect(Collectors.groupingBy(TransactionEntity::getCategory,
                        Collectors.reducing(BigDecimal.ZERO, TransactionEntity::getAmount, BigDecimal::add)));
        BigDecimal total = byCategory.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        List<CategorySpending.CategoryAmount> categories = byCategory.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey()))
                .map(entry -> new CategorySpending.CategoryAmount(
                        entry.getKey(),
                        money(entry.getValue()),
                        HoldingValuation.percentageOf(entry.getValue(), total)))
                .toList();
        return new CategorySpending(categories, money(total), from, to);
    }

    /**
     * Income and expenses per calendar month over the trailing {@code months * 30} days. {@code months}
     * is clamped to [1, 24].
     */
    public MonthlyTrend monthlyTrend(int months) {
        int effective = Math.max(MIN_TREND_MONTHS, Math.min(MAX_TREND_MONTHS, months));
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays((long) effective * DAYS_PER_TREND_MONTH));
        ZoneId zone = clock.getZone();

        Map<String, MonthAccumulator> buckets = new TreeMap<>();
        for (TransactionEntity tx : transactionsBetween(start, end)) {
            String month = YearMonth.from(tx.getTransactionDate().atZone(zone)).toString();
            MonthAccumulator bucket = buckets.computeIfAbsent(month, key -> new MonthAccumulator());
            switch (tx.getTransactionType()) {
                case INCOME -> bucket.income = bucket.income.add(tx.getAmount());
                case EXPENSE -> bucket.expenses = bucket.expenses.add(tx.getAmount());
                case TRANSFER -> {
                }
            }
        }
        List<MonthlyTrend.MonthPoint> trend = buckets.entrySet().stream()
                .map(entry -> {
                    BigDecimal income = money(entry.getValue().income);
                    BigDecimal expenses = money(entry.getValue().expenses);
                    return new MonthlyTrend.MonthPoint(entry.getKey(), income, expenses, income.subtract(expenses));
                })
                .toList();
        return new MonthlyTrend(trend, effective);
    }

    public List<AccountBalance> accountBalances() {
        return accountRepository.findByActiveTrue().stream()
                .map(account -> new AccountBalance(
                        account.getId(),
                        account.getName(),
                        account.getAccountType(),
                        money(account.getBalance()),
                        account.getCurrency()))
                .sorted(Comparator.comparing((AccountBalance balance) -> balance.balance().abs()).reversed())
                .toList();
    }

    public DashboardSummary dashboardSummary() {
        Instant now = clock.instant();
        ZoneId zone = clock.getZone();
        Instant monthStart = now.atZone(zone).toLocalDate().withDayOfMonth(1).atStartOfDay(zone).toInstant();
        return new DashboardSummary(
                netWorth(now),
                cashFlow(monthStart, now),
                spendingByCategory(monthStart, now),
                accountRepository.countByActiveTrue(),
                transactionRepository.countByTransactionDateGreaterThanEqual(monthStart),
                now
        );
    }

    private List<TransactionEntity> transactionsBetween(Instant from, Instant to) {
        return transactionRepository.findByTransactionDateBetweenOrderByTransactionDateAsc(from, to);
    }

    private static BigDecimal sumOf(List<TransactionEntity> transactions, TransactionType type) {
        return transactions.stream()
                .filter(tx -> tx.getTransactionType() == type)
                .map(TransactionEntity::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal money(BigDecimal value) {
        return (value != null ? value : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }

    enum BalanceSheetSide {
        ASSET,
        LIABILITY,
        EXCLUDED
    }

    private static final class MonthAccumulator {
        private BigDecimal income = BigDecimal.ZERO;
        private BigDecimal expenses = BigDecimal.ZERO;
    }
}
