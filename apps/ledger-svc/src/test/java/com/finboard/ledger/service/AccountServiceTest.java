package com.finboard.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.finboard.ledger.entity.AccountEntity;
import com.finboard.ledger.error.NotFoundException;
import com.finboard.ledger.error.ValidationException;
import com.finboard.ledger.model.AccountType;
import com.finboard.ledger.repository.JpaAccountRepository;
import com.finboard.ledger.repository.JpaInvestmentRepository;
import com.finboard.ledger.repository.JpaTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AccountServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @Mock
    private JpaAccountRepository accountRepository;

    @Mock
    private JpaTransactionRepository transactionRepository;

    @Mock
    private JpaInvestmentRepository investmentRepository;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        accountService = new AccountService(accountRepository, transactionRepository, investmentRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(accountRepository.save(any(AccountEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void createAppliesDefaults() {
        AccountEntity created = accountService.createAccount(new AccountService.NewAccount(
                " Brokerage ", AccountType.INVESTMENT, null, null, "Fidelity", null, null));

        assertThat(created.getName()).isEqualTo("Brokerage");
        assertThat(created.getBalance()).isEqualByComparingTo("0");
        assertThat(created.getCurrency()).isEqualTo("USD");
        assertThat(created.isActive()).isTrue();
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void createRequiresName() {
        assertThatThrownBy(() -> accountService.createAccount(new AccountService.NewAccount(
                "", AccountType.CHECKING, null, null, null, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void updateAppliesOnlyProvidedFields() {
        AccountEntity account = new AccountEntity(UUID.randomUUID(), "Card", AccountType.CREDIT_CARD,
                new BigDecimal("-250"), "USD", Instant.parse("2024-01-01T00:00:00Z"));
        account.setInstitution("Amex");
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));

        AccountEntity updated = accountService.updateAccount(account.getId(),
                new AccountService.AccountChanges(null, null, null, null, "closed", false));

        assertThat(updated.getName()).isEqualTo("Card");
        assertThat(updated.getBalance()).isEqualByComparingTo("-250");
        assertThat(updated.getInstitution()).isEqualTo("Amex");
        assertThat(updated.getNotes()).isEqualTo("closed");
        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void deleteRemovesDependentRowsBeforeTheAccount() {
        AccountEntity account = new AccountEntity(UUID.randomUUID(), "Old", AccountType.SAVINGS,
                BigDecimal.TEN, "USD", NOW);
        when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
        when(transactionRepository.deleteByAccountId(account.getId())).thenReturn(3);
        when(investmentRepository.deleteByAccountId(account.getId())).thenReturn(1);

        accountService.deleteAccount(account.getId());

        InOrder order = inOrder(transactionRepository, investmentRepository, accountRepository);
        order.verify(transactionRepository).deleteByAccountId(account.getId());
        order.verify(investmentRepository).deleteByAccountId(account.getId());
        order.verify(accountRepository).delete(account);
    }

    @Test
    void deleteOfUnknownAccountIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(accountRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.deleteAccount(unknown))
                .isInstanceOf(NotFoundException.class);
        verify(transactionRepository, never()).deleteByAccountId(any());
    }
}
