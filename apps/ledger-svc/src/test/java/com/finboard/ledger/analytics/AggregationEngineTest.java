package com.finboard.ledger.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.investment.PortfolioValuator;
import com.finboard.ledger.model.AccountBalance;
import com.finboard.ledger.model.AccountType;
import com.finboard.ledger.model.CashFlow;
import com.finboard.ledger.model.CategorySpending;
import com.finboard.ledger.model.DashboardSummary;
import com.finboard.ledger.model.MonthlyTrend;
import com.finboard.ledger.model.NetWorth;
import com.finboard.ledger.model.PortfolioSummary;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaInvestmentRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AggregationEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @Mock
    private JpaAccountRepository accountRepository;

    @Mock
    private JpaTransactionRepository transactionRepository;

    @Mock
    private JpaInvestmentRepository investmentRepository;

    @Mock
    private PortfolioValuator portfolioValuator;

    private AggregationEngine aggregationEngine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        aggregationEngine = new AggregationEngine(accountRepository, transactionRepository, investmentRepository,
                portfolioValuator, Clock.fixed(NOW, ZoneOffset.UTC));
        when(investmentRepository.findAll()).thenReturn(List.of());
        when(portfolioValuator.portfolioSummary(anyList())).thenReturn(PortfolioSummary.empty());
    }

    @Test
    void netWorthClassifiesAccountsAndAddsPortfolio() {
        AccountEntity closedSavings = account(AccountType.SAVINGS, "500");
        closedSavings.setActive(false);
        when(accountRepository.findAll()).thenReturn(List.of(
                account(AccountType.CHECKING, "1000"),
                closedSavings,
                account(AccountType.CREDIT_CARD, "-300"),
                account(AccountType.LOAN, "2000"),
                account(AccountType.OTHER, "999")
        ));
        when(portfolioValuator.portfolioSummary(anyList())).thenReturn(new PortfolioSummary(
                new BigDecimal("250.00"), new BigDecimal("200.00"), new BigDecimal("50.00"), new BigDecimal("25.00"), 1));

        NetWorth netWorth = aggregationEngine.netWorth();

        assertThat(netWorth.totalAssets()).isEqualByComparingTo("1750.00");
        assertThat(netWorth.totalLiabilities()).isEqualByComparingTo("2300.00");
        assertThat(netWorth.netWorth()).isEqualByComparingTo("-550.00");
        assertThat(netWorth.netWorth()).isEqualTo(netWorth.totalAssets().subtract(netWorth.totalLiabilities()));
        assertThat(netWorth.timestamp()).isEqualTo(NOW);
    }

    @Test
    void netWorthOfEmptyLedgerIsZero() {
        when(accountRepository.findAll()).thenReturn(List.of());

        NetWorth netWorth = aggregationEngine.netWorth();

        assertThat(netWorth.netWorth()).isEqualByComparingTo("0");
        assertThat(netWorth.totalAssets()).isEqualByComparingTo("0");
    }

    @Test
    void everyAccountTypeHasABalanceSheetSide() {
        for (AccountType type : AccountType.values()) {
            assertThat(AggregationEngine.sideOf(type)).isNotNull();
        }
        assertThat(AggregationEngine.sideOf(AccountType.CRYPTO)).isEqualTo(AggregationEngine.BalanceSheetSide.ASSET);
        assertThat(AggregationEngine.sideOf(AccountType.OTHER)).isEqualTo(AggregationEngine.BalanceSheetSide.EXCLUDED);
    }

    @Test
    void cashFlowDefaultsToTrailingThirtyDays() {
        Instant start = NOW.minus(Duration.ofDays(30));
        when(transactionRepository.findByTransactionDateBetweenOrderByTransactionDateAsc(start, NOW)).thenReturn(List.of(
                transaction(TransactionType.INCOME, "3000", "Salary", "2024-03-01T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "120.40", "Groceries", "2024-03-02T09:00:00Z"),
                transaction(TransactionType.TRANSFER, "500", null, "2024-03-03T09:00:00Z")
        ));

        CashFlow cashFlow = aggregationEngine.cashFlow(null, null);

        assertThat(cashFlow.startDate()).isEqualTo(start);
        assertThat(cashFlow.endDate()).isEqualTo(NOW);
        assertThat(cashFlow.totalIncome()).isEqualByComparingTo("3000.00");
        assertThat(cashFlow.totalExpenses()).isEqualByComparingTo("120.40");
        assertThat(cashFlow.netCashFlow()).isEqualByComparingTo("2879.60");
    }

    @Test
    void spendingByCategorySortsDescendingAndPercentagesSumToHundred() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        when(transactionRepository.findByTransactionDateBetweenOrderByTransactionDateAsc(start, NOW)).thenReturn(List.of(
                transaction(TransactionType.EXPENSE, "40", "Groceries", "2024-03-02T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "120", "Rent", "2024-03-01T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "20", "Fun", "2024-03-05T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "20", "Groceries", "2024-03-09T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "75", null, "2024-03-09T09:00:00Z"),
                transaction(TransactionType.INCOME, "900", "Salary", "2024-03-10T09:00:00Z")
        ));

        CategorySpending spending = aggregationEngine.spendingByCategory(start, null);

        assertThat(spending.categories()).extracting(CategorySpending.CategoryAmount::category)
                .containsExactly("Rent", "Groceries", "Fun");
        assertThat(spending.totalSpending()).isEqualByComparingTo("200.00");
        assertThat(spending.categories()).extracting(CategorySpending.CategoryAmount::percentage)
                .containsExactly(new BigDecimal("60.00"), new BigDecimal("30.00"), new BigDecimal("10.00"));
        BigDecimal percentageSum = spending.categories().stream()
                .map(CategorySpending.CategoryAmount::percentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(percentageSum).isEqualByComparingTo("100");
    }

    @Test
    void spendingWithoutExpensesIsEmpty() {
        when(transactionRepository.findByTransactionDateBetweenOrderByTransactionDateAsc(
                NOW.minus(Duration.ofDays(30)), NOW)).thenReturn(List.of());

        CategorySpending spending = aggregationEngine.spendingByCategory(null, null);

        assertThat(spending.categories()).isEmpty();
        assertThat(spending.totalSpending()).isEqualByComparingTo("0");
    }

    @Test
    void monthlyTrendClampsMonths() {
        assertThat(aggregationEngine.monthlyTrend(0).months()).isEqualTo(1);
        assertThat(aggregationEngine.monthlyTrend(30).months()).isEqualTo(24);
        verify(transactionRepository).findByTransactionDateBetweenOrderByTransactionDateAsc(
                NOW.minus(Duration.ofDays(30)), NOW);
        verify(transactionRepository).findByTransactionDateBetweenOrderByTransactionDateAsc(
                NOW.minus(Duration.ofDays(720)), NOW);
    }

    @Test
    void monthlyTrendBucketsByCalendarMonthInOrder() {
        when(transactionRepository.findByTransactionDateBetweenOrderByTransactionDateAsc(
                NOW.minus(Duration.ofDays(90)), NOW)).thenReturn(List.of(
                transaction(TransactionType.TRANSFER, "500", null, "2024-01-20T09:00:00Z"),
                transaction(TransactionType.INCOME, "1000", "Salary", "2024-02-10T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "200", "Rent", "2024-02-20T09:00:00Z"),
                transaction(TransactionType.EXPENSE, "50", "Fun", "2024-03-01T09:00:00Z")
        ));

        MonthlyTrend trend = aggregationEngine.monthlyTrend(3);

        assertThat(trend.trend()).extracting(MonthlyTrend.MonthPoint::month)
                .containsExactly("2024-01", "2024-02", "2024-03");
        MonthlyTrend.MonthPoint january = trend.trend().get(0);
        assertThat(january.income()).isEqualByComparingTo("0");
        assertThat(january.expenses()).isEqualByComparingTo("0");
        MonthlyTrend.MonthPoint february = trend.trend().get(1);
        assertThat(february.net()).isEqualByComparingTo("800.00");
        assertThat(trend.trend().get(2).net()).isEqualByComparingTo("-50.00");
    }

    @Test
    void accountBalancesSortByMagnitude() {
        AccountEntity checking = account(AccountType.CHECKING, "150");
        AccountEntity card = account(AccountType.CREDIT_CARD, "-900");
        AccountEntity savings = account(AccountType.SAVINGS, "400");
        when(accountRepository.findByActiveTrue()).thenReturn(List.of(checking, card, savings));

        List<AccountBalance> balances = aggregationEngine.accountBalances();

        assertThat(balances).extracting(AccountBalance::id)
                .containsExactly(card.getId(), savings.getId(), checking.getId());
        assertThat(balances.get(0).balance()).isEqualByComparingTo("-900.00");
    }

    @Test
    void dashboardSummaryUsesCurrentCalendarMonth() {
        Instant monthStart = Instant.parse("2024-03-01T00:00:00Z");
        when(accountRepository.findAll()).thenReturn(List.of(account(AccountType.CHECKING, "100")));
        when(accountRepository.countByActiveTrue()).thenReturn(1L);
        when(transactionRepository.countByTransactionDateGreaterThanEqual(monthStart)).thenReturn(7L);
        when(transactionRepository.findByTransactionDateBetweenOrderByTransactionDateAsc(monthStart, NOW))
                .thenReturn(List.of(transaction(TransactionType.EXPENSE, "30", "Fun", "2024-03-02T09:00:00Z")));

        DashboardSummary summary = aggregationEngine.dashboardSummary();

        assertThat(summary.netWorth().netWorth()).isEqualByComparingTo("100.00");
        assertThat(summary.currentMonthCashFlow().startDate()).isEqualTo(monthStart);
        assertThat(summary.currentMonthCashFlow().totalExpenses()).isEqualByComparingTo("30.00");
        assertThat(summary.currentMonthSpending().categories()).hasSize(1);
        assertThat(summary.accountCount()).isEqualTo(1L);
        assertThat(summary.currentMonthTransactionCount()).isEqualTo(7L);
    }

    private static AccountEntity account(AccountType type, String balance) {
        return new AccountEntity(UUID.randomUUID(), type.value() + " account", type, new BigDecimal(balance), "USD",
                Instant.parse("2024-01-01T00:00:00Z"));
    }

    private static TransactionEntity transaction(TransactionType type, String amount, String category, String date) {
        return new TransactionEntity(UUID.randomUUID(), UUID.randomUUID(), type, new BigDecimal(amount), category,
                Instant.parse(date), Instant.parse(date));
    }
}
