package com.finboard.ledger.controller;

import com.finboard.ledger.controller.dto.AccountCreateRequestDto;
import com.finboard.ledger.controller.dto.AccountResponseDto;
import com.finboard.ledger.controller.dto.AccountUpdateRequestDto;
import com.finboard.ledger.controller.dto.MessageResponseDto;
import com.finboard.ledger.service.AccountService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
public class AccountsController {

    private final AccountService accountService;

    public AccountsController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public ResponseEntity<List<AccountResponseDto>> listAccounts() {
        return ResponseEntity.ok(accountService.listAccounts().stream().map(AccountResponseDto::from).toList());
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponseDto> getAccount(@PathVariable("accountId") UUID accountId) {
        return ResponseEntity.ok(AccountResponseDto.from(accountService.getAccount(accountId)));
    }

    @PostMapping
    public ResponseEntity<AccountResponseDto> createAccount(@RequestBody @Valid AccountCreateRequestDto request) {
        var created = accountService.createAccount(new AccountService.NewAccount(
                request.name(),
                request.accountType(),
                request.balance(),
                request.currency(),
                request.institution(),
                request.accountNumber(),
                request.notes()
        ));
        return ResponseEntity.ok(AccountResponseDto.from(created));
    }

    @PutMapping("/{accountId}")
    public ResponseEntity<AccountResponseDto> updateAccount(
            @PathVariable("accountId") UUID accountId,
            @RequestBody @Valid AccountUpdateRequestDto request
    ) {
        var updated = accountService.updateAccount(accountId, new AccountService.AccountChanges(
                request.name(),
                request.balance(),
                request.institution(),
                request.accountNumber(),
                request.notes(),
                request.isActive()
        ));
        return ResponseEntity.ok(AccountResponseDto.from(updated));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<MessageResponseDto> deleteAccount(@PathVariable("accountId") UUID accountId) {
        accountService.deleteAccount(accountId);
        return ResponseEntity.ok(new MessageResponseDto("Account deleted successfully"));
    }
}
