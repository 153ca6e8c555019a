package com.finboard.ledger.controller;

import com.finboard.ledger.analytics.AggregationEngine;
import com.finboard.ledger.model.AccountBalance;
import com.finboard.ledger.model.CashFlow;
import com.finboard.ledger.model.CategorySpending;
import com.finboard.ledger.model.DashboardSummary;
import com.finboard.ledger.model.MonthlyTrend;
import com.finboard.ledger.model.NetWorth;
import com.finboard.ledger.support.DateTimes;
import java.time.Clock;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private final AggregationEngine aggregationEngine;
    private final Clock clock;

    public AnalyticsController(AggregationEngine aggregationEngine, Clock clock) {
        this.aggregationEngine = aggregationEngine;
        this.clock = clock;
    }

    @GetMapping("/net-worth")
    public ResponseEntity<NetWorth> netWorth() {
        return ResponseEntity.ok(aggregationEngine.netWorth());
    }

    @GetMapping("/cash-flow")
    public ResponseEntity<CashFlow> cashFlow(
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate
    ) {
        return ResponseEntity.ok(aggregationEngine.cashFlow(
                DateTimes.parseInstant(startDate, clock.getZone()),
                DateTimes.parseInstant(endDate, clock.getZone())));
    }

    @GetMapping("/spending-by-category")
    public ResponseEntity<CategorySpending> spendingByCategory(
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate
    ) {
        return ResponseEntity.ok(aggregationEngine.spendingByCategory(
                DateTimes.parseInstant(startDate, clock.getZone()),
                DateTimes.parseInstant(endDate, clock.getZone())));
    }

    @GetMapping("/income-vs-expenses-trend")
    public ResponseEntity<MonthlyTrend> incomeVsExpensesTrend(
            @RequestParam(value = "months", required = false, defaultValue = "6") int months
    ) {
        return ResponseEntity.ok(aggregationEngine.monthlyTrend(months));
    }

    @GetMapping("/account-balances")
    public ResponseEntity<List<AccountBalance>> accountBalances() {
        return ResponseEntity.ok(aggregationEngine.accountBalances());
    }

    @GetMapping("/dashboard-summary")
    public ResponseEntity<DashboardSummary> dashboardSummary() {
        return ResponseEntity.ok(aggregationEngine.dashboardSummary());
    }
}
