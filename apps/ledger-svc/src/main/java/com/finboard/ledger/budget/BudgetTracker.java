package com.finboard.ledger.budget;

import com.finboard.ledger.entity.BudgetEntity;
import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.model.BudgetPeriod;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.repository.JpaBudgetRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Measures budget consumption. The window a budget is measured over is derived from its period tag
 * and the current time only; nothing about the window is stored.
 */
@Component
public class BudgetTracker {
    private static final Logger log = LoggerFactory.getLogger(BudgetTracker.class);

    private final JpaTransactionRepository transactionRepository;
    private final JpaBudgetRepository budgetRepository;
    private final Clock clock;

    public BudgetTracker(JpaTransactionRepository transactionRepository, JpaBudgetRepository budgetRepository, Clock clock) {
        this.transactionRepository = transactionRepository;
        this.budgetRepository = budgetRepository;
        this.clock = clock;
    }

    public static ZonedDateTime periodWindowStart(BudgetPeriod period, ZonedDateTime now) {
        return switch (period) {
            case MONTHLY -> now.toLocalDate().withDayOfMonth(1).atStartOfDay(now.getZone());
            case YEARLY -> now.toLocalDate().withDayOfYear(1).atStartOfDay(now.getZone());
            case ROLLING_30_DAYS -> now.minusDays(30);
        };
    }

    /**
     * Sum of expense amounts booked to {@code category} since the start of the period window.
     */
    public BigDecimal recomputeSpent(String category, String periodTag, ZonedDateTime now) {
        Instant from = periodWindowStart(BudgetPeriod.fromTag(periodTag), now).toInstant();
        return transactionRepository
                .findByCategoryAndTransactionTypeAndTransactionDateGreaterThanEqual(category, TransactionType.EXPENSE, from)
                .stream()
                .map(TransactionEntity::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Recomputes spend as of now and caches it on the budget row. A budget deleted in the meantime is
     * left deleted.
     */
    public BudgetView refreshSpent(BudgetEntity budget) {
        BigDecimal spent = recomputeSpent(budget.getCategory(), budget.getPeriod(), ZonedDateTime.now(clock));
        budget.setSpent(spent);
        if (budgetRepository.updateSpent(budget.getId(), spent) == 0) {
            log.debug("Discarded spent write-back for budget {} (no longer exists)", budget.getId());
        }
        return BudgetView.of(budget);
    }
}
