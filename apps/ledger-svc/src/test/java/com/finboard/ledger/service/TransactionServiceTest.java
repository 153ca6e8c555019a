package com.finboard.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.model.AccountType;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

class TransactionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @Mock
    private JpaTransactionRepository transactionRepository;

    @Mock
    private JpaAccountRepository accountRepository;

    private TransactionService transactionService;

    private AccountEntity account;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        transactionService = new TransactionService(transactionRepository, accountRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
        account = new AccountEntity(UUID.randomUUID(), "Everyday", AccountType.CHECKING, new BigDecimal("100.00"),
                "USD", NOW);
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(transactionRepository.save(any(TransactionEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void expenseCreateThenDeleteRestoresBalance() {
        TransactionEntity created = transactionService.createTransaction(request(TransactionType.EXPENSE, "40.25"));
        assertThat(account.getBalance()).isEqualByComparingTo("59.75");

        when(transactionRepository.findById(created.getId())).thenReturn(Optional.of(created));
        transactionService.deleteTransaction(created.getId());

        assertThat(account.getBalance()).isEqualByComparingTo("100.00");
        verify(transactionRepository).delete(created);
    }

    @Test
    void incomeCreateThenDeleteRestoresBalance() {
        TransactionEntity created = transactionService.createTransaction(request(TransactionType.INCOME, "2500"));
        assertThat(account.getBalance()).isEqualByComparingTo("2600.00");

        when(transactionRepository.findById(created.getId())).thenReturn(Optional.of(created));
        transactionService.deleteTransaction(created.getId());

        assertThat(account.getBalance()).isEqualByComparingTo("100.00");
    }

    @Test
    void transferLeavesBalanceUnchanged() {
        transactionService.createTransaction(request(TransactionType.TRANSFER, "75"));

        assertThat(account.getBalance()).isEqualByComparingTo("100.00");
        verify(accountRepository, never()).save(any());
    }

    @Test
    void createStoresTagsAndTrimsBlankFields() {
        var request = new TransactionService.NewTransaction(account.getId(), TransactionType.EXPENSE,
                new BigDecimal("12"), " Groceries ", " ", "weekly shop", List.of("food", "essential"), NOW);

        TransactionEntity created = transactionService.createTransaction(request);

        assertThat(created.getCategory()).isEqualTo("Groceries");
        assertThat(created.getMerchant()).isNull();
        assertThat(created.getTags()).isEqualTo("food,essential");
        assertThat(created.getTagList()).containsExactly("food", "essential");
    }

    @Test
    void createForUnknownAccountIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(accountRepository.findById(unknown)).thenReturn(Optional.empty());
        var request = new TransactionService.NewTransaction(unknown, TransactionType.EXPENSE, BigDecimal.ONE,
                null, null, null, List.of(), NOW);

        assertThatThrownBy(() -> transactionService.createTransaction(request))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Account not found");
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void negativeAmountIsRejected() {
        assertThatThrownBy(() -> transactionService.createTransaction(request(TransactionType.EXPENSE, "-5")))
                .isInstanceOf(ValidationException.class);
        assertThat(account.getBalance()).isEqualByComparingTo("100.00");
    }

    @Test
    void updateDoesNotTouchBalance() {
        TransactionEntity existing = new TransactionEntity(UUID.randomUUID(), account.getId(), TransactionType.EXPENSE,
                new BigDecimal("10"), "Fun", NOW, NOW);
        when(transactionRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

        TransactionEntity updated = transactionService.updateTransaction(existing.getId(),
                new TransactionService.TransactionChanges(new BigDecimal("99"), "Dining", null, null, null, null));

        assertThat(updated.getAmount()).isEqualByComparingTo("99");
        assertThat(updated.getCategory()).isEqualTo("Dining");
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
        assertThat(account.getBalance()).isEqualByComparingTo("100.00");
        verify(accountRepository, never()).save(any());
    }

    @Test
    void deleteOfUnknownTransactionIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(transactionRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> transactionService.deleteTransaction(unknown))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Transaction not found");
    }

    @Test
    @SuppressWarnings("unchecked")
    void listPushesOffsetAndLimitIntoTheQuery() {
        List<TransactionEntity> window = IntStream.range(1, 3)
                .mapToObj(i -> new TransactionEntity(UUID.randomUUID(), account.getId(), TransactionType.EXPENSE,
                        BigDecimal.valueOf(i), "Fun", NOW.minusSeconds(i * 60L), NOW))
                .toList();
        when(transactionRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(window));

        List<TransactionEntity> page = transactionService.listTransactions(
                new TransactionService.TransactionFilter(null, null, null, null, null, 2, 1));

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(transactionRepository).findAll(any(Specification.class), pageable.capture());
        assertThat(pageable.getValue().getOffset()).isEqualTo(1);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(2);
        assertThat(pageable.getValue().getSort().getOrderFor("transactionDate").isDescending()).isTrue();
        assertThat(page).containsExactlyElementsOf(window);
    }

    @Test
    @SuppressWarnings("unchecked")
    void zeroLimitSkipsTheQuery() {
        List<TransactionEntity> page = transactionService.listTransactions(
                new TransactionService.TransactionFilter(null, null, null, null, null, 0, 0));

        assertThat(page).isEmpty();
        verify(transactionRepository, never()).findAll(any(Specification.class), any(Pageable.class));
    }

    @Test
    void listRejectsOversizedLimit() {
        var filter = new TransactionService.TransactionFilter(null, null, null, null, null, 1001, 0);

        assertThatThrownBy(() -> transactionService.listTransactions(filter))
                .isInstanceOf(ValidationException.class);
    }

    private TransactionService.NewTransaction request(TransactionType type, String amount) {
        return new TransactionService.NewTransaction(account.getId(), type, new BigDecimal(amount), "General",
                null, null, List.of(), NOW);
    }
}
