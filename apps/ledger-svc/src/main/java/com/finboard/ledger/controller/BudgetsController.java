package com.finboard.ledger.controller;

import com.finboard.ledger.budget.BudgetService;
import com.finboard.ledger.budget.BudgetView;
import com.finboard.ledger.controller.dto.BudgetCreateRequestDto;
import com.finboard.ledger.controller.dto.BudgetUpdateRequestDto;
import com.finboard.ledger.controller.dto.MessageResponseDto;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
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
@RequestMapping("/api/budgets")
public class BudgetsController {

    private final BudgetService budgetService;

    public BudgetsController(BudgetService budgetService) {
        this.budgetService = budgetService;
    }

    @GetMapping
    public ResponseEntity<List<BudgetView>> listBudgets() {
        return ResponseEntity.ok(budgetService.listBudgets());
    }

    @GetMapping("/{budgetId}")
    public ResponseEntity<BudgetView> getBudget(@PathVariable("budgetId") UUID budgetId) {
        return ResponseEntity.ok(budgetService.getBudget(budgetId));
    }

    @PostMapping
    public ResponseEntity<BudgetView> createBudget(@RequestBody @Valid BudgetCreateRequestDto request) {
        return ResponseEntity.ok(budgetService.createBudget(request.category(), request.amount(), request.period()));
    }

    @PutMapping("/{budgetId}")
    public ResponseEntity<BudgetView> updateBudget(
            @PathVariable("budgetId") UUID budgetId,
            @RequestBody @Valid BudgetUpdateRequestDto request
    ) {
        return ResponseEntity.ok(budgetService.updateBudget(budgetId,
                Optional.ofNullable(request.amount()),
                Optional.ofNullable(request.period())));
    }

    @DeleteMapping("/{budgetId}")
    public ResponseEntity<MessageResponseDto> deleteBudget(@PathVariable("budgetId") UUID budgetId) {
        budgetService.deleteBudget(budgetId);
        return ResponseEntity.ok(new MessageResponseDto("Budget deleted successfully"));
    }
}
