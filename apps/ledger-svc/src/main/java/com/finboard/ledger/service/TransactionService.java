package com.finboard.ledger.service;

import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import com.finboard.ledger.repository.OffsetLimitRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ledger entries and the account balance they drive. Create and delete move the owning account's
 * balance by the entry's signed effect inside the same transaction; update never touches it.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final JpaTransactionRepository transactionRepository;
    private final JpaAccountRepository accountRepository;
    private final Clock clock;

    public TransactionService(
            JpaTransactionRepository transactionRepository,
            JpaAccountRepository accountRepository,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TransactionEntity> listTransactions(TransactionFilter filter) {
        int limit = filter.limit() != null ? filter.limit() : DEFAULT_LIMIT;
        int offset = filter.offset() != null ? filter.offset() : 0;
        if (limit < 0 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 0 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        if (limit == 0) {
            return List.of();
        }
        OffsetLimitRequest window = new OffsetLimitRequest(offset, limit, Sort.by(Sort.Direction.DESC, "transactionDate"));
        return transactionRepository.findAll(toSpecification(filter), window).getContent();
    }

    @Transactional(readOnly = true)
    public TransactionEntity getTransaction(UUID transactionId) {
        return requireTransaction(transactionId);
    }

    @Transactional
    public TransactionEntity createTransaction(NewTransaction request) {
        if (request.accountId() == null) {
            throw new ValidationException("account_id must be provided");
        }
        AccountEntity account = accountRepository.findById(request.accountId())
                .orElseThrow(() -> NotFoundException.of("Account"));
        if (request.transactionType() == null) {
            throw new ValidationException("transaction_type must be provided");
        }
        requireAmount(request.amount());
        if (request.transactionDate() == null) {
            throw new ValidationException("transaction_date must be provided");
        }

        Instant now = clock.instant();
        TransactionEntity transaction = new TransactionEntity(
                UUID.randomUUID(),
                account.getId(),
                request.transactionType(),
                request.amount(),
                blankToNull(request.category()),
                request.transactionDate(),
                now
        );
        transaction.setMerchant(blankToNull(request.merchant()));
        transaction.setDescription(blankToNull(request.description()));
        transaction.setTagList(request.tags());

        applyBalanceEffect(account, request.transactionType().balanceEffect(request.amount()), now);
        TransactionEntity saved = transactionRepository.save(transaction);
        log.debug("Recorded {} of {} on account {}", saved.getTransactionType().value(), saved.getAmount(),
                account.getId());
        return saved;
    }

    /**
     * Edits descriptive fields and the amount or date of an entry. The account balance is left as it
     * was; only create and delete move it.
     */
    @Transactional
    public TransactionEntity updateTransaction(UUID transactionId, TransactionChanges changes) {
        TransactionEntity transaction = requireTransaction(transactionId);
        if (changes.amount() != null) {
            requireAmount(changes.amount());
            transaction.setAmount(changes.amount());
        }
        if (changes.category() != null) {
            transaction.setCategory(blankToNull(changes.category()));
        }
        if (changes.merchant() != null) {
            transaction.setMerchant(changes.merchant());
        }
        if (changes.description() != null) {
            transaction.setDescription(changes.description());
        }
        if (changes.tags() != null) {
            transaction.setTagList(changes.tags());
        }
        if (changes.transactionDate() != null) {
            transaction.setTransactionDate(changes.transactionDate());
        }
        transaction.setUpdatedAt(clock.instant());
        return transactionRepository.save(transaction);
    }

    @Transactional
    public void deleteTransaction(UUID transactionId) {
        TransactionEntity transaction = requireTransaction(transactionId);
        BigDecimal effect = transaction.getTransactionType().balanceEffect(transaction.getAmount());
        accountRepository.findById(transaction.getAccountId())
                .ifPresent(account -> applyBalanceEffect(account, effect.negate(), clock.instant()));
        transactionRepository.delete(transaction);
    }

    @Transactional(readOnly = true)
    public List<String> listCategories() {
        return transactionRepository.findDistinctCategories();
    }

    private void applyBalanceEffect(AccountEntity account, BigDecimal effect, Instant now) {
        if (effect.signum() == 0) {
            return;
        }
        BigDecimal balance = account.getBalance() != null ? account.getBalance() : BigDecimal.ZERO;
        account.setBalance(balance.add(effect));
        account.setUpdatedAt(now);
        accountRepository.save(account);
    }

    private TransactionEntity requireTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> NotFoundException.of("Transaction"));
    }

    private static void requireAmount(BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException("amount must be provided");
        }
        if (amount.signum() < 0) {
            throw new ValidationException("amount must not be negative");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Specification<TransactionEntity> toSpecification(TransactionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.accountId() != null) {
                predicates.add(cb.equal(root.get("accountId"), filter.accountId()));
            }
            if (filter.category() != null && !filter.category().isBlank()) {
                predicates.add(cb.equal(root.get("category"), filter.category()));
            }
            if (filter.transactionType() != null) {
                predicates.add(cb.equal(root.get("transactionType"), filter.transactionType()));
            }
            if (filter.start() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("transactionDate"), filter.start()));
            }
            if (filter.end() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("transactionDate"), filter.end()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public record TransactionFilter(
            UUID accountId,
            String category,
            TransactionType transactionType,
            Instant start,
            Instant end,
            Integer limit,
            Integer offset
    ) {
        public static TransactionFilter all() {
            return new TransactionFilter(null, null, null, null, null, null, null);
        }
    }

    public record NewTransaction(
            UUID accountId,
            TransactionType transactionType,
            BigDecimal amount,
            String category,
            String merchant,
            String description,
            List<String> tags,
            Instant transactionDate
    ) {
    }

    public record TransactionChanges(
            BigDecimal amount,
            String category,
            String merchant,
            String description,
            List<String> tags,
            Instant transactionDate
    ) {
    }
}
