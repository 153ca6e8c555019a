package com.finboard.ledger.controller;

import com.finboard.ledger.controller.dto.MessageResponseDto;
import com.finboard.ledger.controller.dto.TransactionCreateRequestDto;
import com.finboard.ledger.controller.dto.TransactionResponseDto;
import com.finboard.ledger.controller.dto.TransactionUpdateRequestDto;
import com.finboard.ledger.model.TransactionType;
import com.finboard.ledger.service.TransactionService;
import com.finboard.ledger.support.DateTimes;
import jakarta.validation.Valid;
import java.time.Clock;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transactions")
public class TransactionsController {

    private final TransactionService transactionService;
    private final Clock clock;

    public TransactionsController(TransactionService transactionService, Clock clock) {
        this.transactionService = transactionService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<TransactionResponseDto>> listTransactions(
            @RequestParam(value = "account_id", required = false) UUID accountId,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "transaction_type", required = false) String transactionType,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestParam(value = "limit", required = false, defaultValue = "100") Integer limit,
            @RequestParam(value = "offset", required = false, defaultValue = "0") Integer offset
    ) {
        var filter = new TransactionService.TransactionFilter(
                accountId,
                category,
                transactionType == null || transactionType.isBlank() ? null : TransactionType.fromValue(transactionType),
                DateTimes.parseInstant(startDate, clock.getZone()),
                DateTimes.parseInstant(endDate, clock.getZone()),
                limit,
                offset
        );
        return ResponseEntity.ok(transactionService.listTransactions(filter).stream()
                .map(TransactionResponseDto::from)
                .toList());
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<TransactionResponseDto> getTransaction(@PathVariable("transactionId") UUID transactionId) {
        return ResponseEntity.ok(TransactionResponseDto.from(transactionService.getTransaction(transactionId)));
    }

    @PostMapping
    public ResponseEntity<TransactionResponseDto> createTransaction(@RequestBody @Valid TransactionCreateRequestDto request) {
        var created = transactionService.createTransaction(new TransactionService.NewTransaction(
                request.accountId(),
                request.transactionType(),
                request.amount(),
                request.category(),
                request.merchant(),
                request.description(),
                request.tags(),
                DateTimes.parseInstant(request.transactionDate(), clock.getZone())
        ));
        return ResponseEntity.ok(TransactionResponseDto.from(created));
    }

    @PutMapping("/{transactionId}")
    public ResponseEntity<TransactionResponseDto> updateTransaction(
            @PathVariable("transactionId") UUID transactionId,
            @RequestBody @Valid TransactionUpdateRequestDto request
    ) {
        var updated = transactionService.updateTransaction(transactionId, new TransactionService.TransactionChanges(
                request.amount(),
                request.category(),
                request.merchant(),
                request.description(),
                request.tags(),
                DateTimes.parseInstant(request.transactionDate(), clock.getZone())
        ));
        return ResponseEntity.ok(TransactionResponseDto.from(updated));
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<MessageResponseDto> deleteTransaction(@PathVariable("transactionId") UUID transactionId) {
        transactionService.deleteTransaction(transactionId);
        return ResponseEntity.ok(new MessageResponseDto("Transaction deleted successfully"));
    }

    @GetMapping("/categories/list")
    public ResponseEntity<List<String>> listCategories() {
        return ResponseEntity.ok(transactionService.listCategories());
    }
}
