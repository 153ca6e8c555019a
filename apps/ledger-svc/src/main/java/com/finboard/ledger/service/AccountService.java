package com.finboard.ledger.service;

import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.model.AccountType;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaInvestmentRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);
    private static final String DEFAULT_CURRENCY = "USD";

    private final JpaAccountRepository accountRepository;
    private final JpaTransactionRepository transactionRepository;
    private final JpaInvestmentRepository investmentRepository;
    private final Clock clock;

    public AccountService(
            JpaAccountRepository accountRepository,
            JpaTransactionRepository transactionRepository,
            JpaInvestmentRepository investmentRepository,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.investmentRepository = investmentRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AccountEntity> listAccounts() {
        return accountRepository.findAll(Sort.by("createdAt"));
    }

    @Transactional(readOnly = true)
    public AccountEntity getAccount(UUID accountId) {
        return requireAccount(accountId);
    }

    @Transactional
    public AccountEntity createAccount(NewAccount request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name must be provided");
        }
        if (request.accountType() == null) {
            throw new ValidationException("account_type must be provided");
        }
        AccountEntity account = new AccountEntity(
                UUID.randomUUID(),
                request.name().trim(),
                request.accountType(),
                request.balance() != null ? request.balance() : BigDecimal.ZERO,
                request.currency() == null || request.currency().isBlank() ? DEFAULT_CURRENCY : request.currency(),
                clock.instant()
        );
        account.setInstitution(request.institution());
        account.setAccountNumber(request.accountNumber());
        account.setNotes(request.notes());
        return accountRepository.save(account);
    }

    /**
     * Applies the non-null fields of {@code changes}; a null field leaves the stored value as is.
     */
    @Transactional
    public AccountEntity updateAccount(UUID accountId, AccountChanges changes) {
        AccountEntity account = requireAccount(accountId);
        if (changes.name() != null) {
            if (changes.name().isBlank()) {
                throw new ValidationException("name must not be blank");
            }
            account.setName(changes.name().trim());
        }
        if (changes.balance() != null) {
            account.setBalance(changes.balance());
        }
        if (changes.institution() != null) {
            account.setInstitution(changes.institution());
        }
        if (changes.accountNumber() != null) {
            account.setAccountNumber(changes.accountNumber());
        }
        if (changes.notes() != null) {
            account.setNotes(changes.notes());
        }
        if (changes.active() != null) {
            account.setActive(changes.active());
        }
        account.setUpdatedAt(clock.instant());
        return accountRepository.save(account);
    }

    @Transactional
    public void deleteAccount(UUID accountId) {
        AccountEntity account = requireAccount(accountId);
        int transactions = transactionRepository.deleteByAccountId(accountId);
        int holdings = investmentRepository.deleteByAccountId(accountId);
        accountRepository.delete(account);
        log.info("Deleted account {} with {} transactions and {} holdings", accountId, transactions, holdings);
    }

    private AccountEntity requireAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> NotFoundException.of("Account"));
    }

    public record NewAccount(
            String name,
            AccountType accountType,
            BigDecimal balance,
            String currency,
            String institution,
            String accountNumber,
            String notes
    ) {
    }

    public record AccountChanges(
            String name,
            BigDecimal balance,
            String institution,
            String accountNumber,
            String notes,
            Boolean active
    ) {
    }
}
