package com.finboard.ledger.controller;

import com.finboard.ledger.controller.dto.InvestmentCreateRequestDto;
import com.finboard.ledger.controller.dto.InvestmentUpdateRequestDto;
import com.finboard.ledger.controller.dto.MessageResponseDto;
import com.finboard.ledger.investment.InvestmentService;
import com.finboard.ledger.investment.InvestmentView;
import com.finboard.ledger.model.PortfolioSummary;
import com.finboard.ledger.model.PriceQuote;
import com.finboard.ledger.support.DateTimes;
import jakarta.validation.Valid;
import java.time.Clock;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/investments")
public class InvestmentsController {

    private final InvestmentService investmentService;
    private final Clock clock;

    public InvestmentsController(InvestmentService investmentService, Clock clock) {
        this.investmentService = investmentService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<InvestmentView>> listInvestments(
            @RequestParam(value = "account_id", required = false) UUID accountId
    ) {
        return ResponseEntity.ok(investmentService.listInvestments(Optional.ofNullable(accountId)));
    }

    @GetMapping("/{investmentId}")
    public ResponseEntity<InvestmentView> getInvestment(@PathVariable("investmentId") UUID investmentId) {
        return ResponseEntity.ok(investmentService.getInvestment(investmentId));
    }

    @PostMapping
    public ResponseEntity<InvestmentView> createInvestment(@RequestBody @Valid InvestmentCreateRequestDto request) {
        return ResponseEntity.ok(investmentService.createInvestment(new InvestmentService.NewInvestment(
                request.accountId(),
                request.symbol(),
                request.name(),
                request.assetType(),
                request.exchange(),
                request.quantity(),
                request.purchasePrice(),
                request.currency(),
                DateTimes.parseInstant(request.purchaseDate(), clock.getZone())
        )));
    }

    @PutMapping("/{investmentId}")
    public ResponseEntity<InvestmentView> updateInvestment(
            @PathVariable("investmentId") UUID investmentId,
            @RequestBody @Valid InvestmentUpdateRequestDto request
    ) {
        return ResponseEntity.ok(investmentService.updateInvestment(investmentId,
                Optional.ofNullable(request.quantity()),
                Optional.ofNullable(request.purchasePrice()),
                Optional.ofNullable(request.name())));
    }

    @DeleteMapping("/{investmentId}")
    public ResponseEntity<MessageResponseDto> deleteInvestment(@PathVariable("investmentId") UUID investmentId) {
        investmentService.deleteInvestment(investmentId);
        return ResponseEntity.ok(new MessageResponseDto("Investment deleted successfully"));
    }

    @PostMapping("/{investmentId}/refresh-price")
    public ResponseEntity<InvestmentView> refreshPrice(@PathVariable("investmentId") UUID investmentId) {
        return ResponseEntity.ok(investmentService.refreshPrice(investmentId));
    }

    @GetMapping("/portfolio/summary")
    public ResponseEntity<PortfolioSummary> portfolioSummary() {
        return ResponseEntity.ok(investmentService.portfolioSummary());
    }

    @GetMapping("/search/{query}")
    public ResponseEntity<List<PriceQuote>> searchTicker(@PathVariable("query") String query) {
        return ResponseEntity.ok(investmentService.searchTicker(query));
    }
}
