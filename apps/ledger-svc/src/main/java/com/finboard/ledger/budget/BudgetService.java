package com.finboard.ledger.budget;

import com.finboard.ledger.entity.BudgetEntity;
import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.model.BudgetPeriod;
import com.finboard.ledger.repository.JpaBudgetRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

@Service
public class BudgetService {

    static final String DUPLICATE_CATEGORY = "Budget for this category already exists";

    private final JpaBudgetRepository budgetRepository;
    private final BudgetTracker budgetTracker;
    private final Clock clock;

    public BudgetService(JpaBudgetRepository budgetRepository, BudgetTracker budgetTracker, Clock clock) {
        this.budgetRepository = budgetRepository;
        this.budgetTracker = budgetTracker;
        this.clock = clock;
    }

    public List<BudgetView> listBudgets() {
        return budgetRepository.findAll(Sort.by("category")).stream()
                .map(budgetTracker::refreshSpent)
                .toList();
    }

    public BudgetView getBudget(UUID budgetId) {
        return budgetTracker.refreshSpent(requireBudget(budgetId));
    }

    public BudgetView createBudget(String category, BigDecimal amount, String period) {
        if (category == null || category.isBlank()) {
            throw new ValidationException("category must be provided");
        }
        requireNonNegative(amount);
        if (budgetRepository.existsByCategory(category)) {
            throw new ValidationException(DUPLICATE_CATEGORY);
        }
        String periodTag = period == null || period.isBlank() ? BudgetPeriod.DEFAULT_TAG : period;
        BudgetEntity budget = new BudgetEntity(UUID.randomUUID(), category, amount, periodTag, clock.instant());
        try {
            return BudgetView.of(budgetRepository.saveAndFlush(budget));
        } catch (DataIntegrityViolationException ex) {
            // unique constraint on category, concurrent create
            throw new ValidationException(DUPLICATE_CATEGORY);
        }
    }

    public BudgetView updateBudget(UUID budgetId, Optional<BigDecimal> amount, Optional<String> period) {
        BudgetEntity budget = requireBudget(budgetId);
        amount.ifPresent(value -> {
            requireNonNegative(value);
            budget.setAmount(value);
        });
        period.filter(value -> !value.isBlank()).ifPresent(budget::setPeriod);
        budget.setUpdatedAt(clock.instant());
        return BudgetView.of(budgetRepository.save(budget));
    }

    public void deleteBudget(UUID budgetId) {
        budgetRepository.delete(requireBudget(budgetId));
    }

    private BudgetEntity requireBudget(UUID budgetId) {
        return budgetRepository.findById(budgetId)
                .orElseThrow(() -> NotFoundException.of("Budget"));
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new ValidationException("amount must not be negative");
        }
    }
}
