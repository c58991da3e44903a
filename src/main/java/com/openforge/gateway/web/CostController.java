package com.openforge.gateway.web;

import com.openforge.gateway.cost.BudgetCheck;
import com.openforge.gateway.cost.CostAlert;
import com.openforge.gateway.cost.CostAnalytics;
import com.openforge.gateway.cost.CostPrediction;
import com.openforge.gateway.cost.CostSnapshot;
import com.openforge.gateway.cost.CostStatus;
import com.openforge.gateway.cost.CostTracker;
import com.openforge.gateway.cost.TrendAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the spend ledger and its analytics, plus a dry-run
 * budget check.  Nothing here blocks requests.
 */
@RestController
@RequestMapping("/v1/costs")
@RequiredArgsConstructor
public class CostController {

    private final CostTracker   costTracker;
    private final CostAnalytics costAnalytics;
    private final Clock         clock;

    @GetMapping("/status")
    public CostStatus status() {
        return costTracker.getStatus();
    }

    @GetMapping("/alerts")
    public List<CostAlert> alerts() {
        return costAnalytics.getAlerts();
    }

    @GetMapping("/trends")
    public TrendAnalysis trends() {
        return costAnalytics.getTrends();
    }

    @GetMapping("/prediction")
    public CostPrediction prediction() {
        return costAnalytics.predictMonthlyCost();
    }

    /** Snapshots at or after {@code since}; defaults to the last 24 hours. */
    @GetMapping("/history")
    public List<CostSnapshot> history(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        Instant from = since != null ? since : clock.instant().minus(Duration.ofHours(24));
        return costAnalytics.getHistoricalData(from);
    }

    @PostMapping("/budget-check")
    public BudgetCheck budgetCheck(@RequestParam double estimatedCost) {
        return costTracker.checkBudget(estimatedCost);
    }
}
