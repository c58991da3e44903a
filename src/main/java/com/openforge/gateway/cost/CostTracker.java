package com.openforge.gateway.cost;

import com.openforge.gateway.llm.model.CompletionResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory spend ledger with daily and monthly budgets.
 *
 * Running sums:
 *   daily      reset when the calendar day (in the clock's zone) changes
 *   monthly    reset when the calendar month changes
 *   total      lifetime of the process, never reset by a period change
 *
 * Every read and write first runs the same period rollover check, so a
 * status read just after midnight already shows the new day as empty.
 *
 * Budgets are reported, never enforced here: {@link #checkBudget} is
 * available to callers that want to block, and nothing in the routing layer
 * calls it.
 */
@Slf4j
public class CostTracker {

    private final double dailyBudget;
    private final double monthlyBudget;
    private final Clock  clock;

    private final ReentrantLock lock = new ReentrantLock();
    private double    dailySpend;
    private double    monthlySpend;
    private double    totalSpend;
    private long      requestCount;
    private long      tokenCount;
    private LocalDate lastDailyReset;
    private YearMonth lastMonthlyReset;

    public CostTracker(double dailyBudget, double monthlyBudget, Clock clock) {
        this.dailyBudget   = dailyBudget;
        this.monthlyBudget = monthlyBudget;
        this.clock         = clock;
        LocalDate today = LocalDate.now(clock);
        this.lastDailyReset   = today;
        this.lastMonthlyReset = YearMonth.from(today);
    }

    // ── Write path ───────────────────────────────────────────────────────────

    /**
     * Prices one completion and adds it to every running sum.
     *
     * @return the cost of this call in USD
     */
    public double trackUsage(String model, long promptTokens, long completionTokens) {
        double cost = ModelPricing.calculateCost(model, promptTokens, completionTokens);
        lock.lock();
        try {
            rolloverIfNeeded();
            dailySpend   += cost;
            monthlySpend += cost;
            totalSpend   += cost;
            requestCount++;
            tokenCount   += promptTokens + completionTokens;
        } finally {
            lock.unlock();
        }
        if (!ModelPricing.isKnown(model)) {
            log.debug("[CostTracker] No price for model {}; billed at default rate", model);
        }
        return cost;
    }

    public double trackUsage(CompletionResponse response) {
        CompletionResponse.Usage usage = response.usage();
        return trackUsage(response.model(), usage.promptTokens(), usage.completionTokens());
    }

    /** Administrative zeroing of every sum and counter. */
    public void reset() {
        lock.lock();
        try {
            dailySpend = 0;
            monthlySpend = 0;
            totalSpend = 0;
            requestCount = 0;
            tokenCount = 0;
            LocalDate today = LocalDate.now(clock);
            lastDailyReset = today;
            lastMonthlyReset = YearMonth.from(today);
            log.info("[CostTracker] Ledger reset");
        } finally {
            lock.unlock();
        }
    }

    // ── Read path ────────────────────────────────────────────────────────────

    public double calculateCost(String model, long promptTokens, long completionTokens) {
        return ModelPricing.calculateCost(model, promptTokens, completionTokens);
    }

    /**
     * Whether adding {@code estimatedCost} would stay inside the configured
     * budgets.  A budget of zero or less is not enforced.
     */
    public BudgetCheck checkBudget(double estimatedCost) {
        lock.lock();
        try {
            rolloverIfNeeded();
            if (dailyBudget > 0 && dailySpend + estimatedCost > dailyBudget) {
                return BudgetCheck.denied("daily budget exceeded: $%.4f + $%.4f > $%.2f"
                        .formatted(dailySpend, estimatedCost, dailyBudget));
            }
            if (monthlyBudget > 0 && monthlySpend + estimatedCost > monthlyBudget) {
                return BudgetCheck.denied("monthly budget exceeded: $%.4f + $%.4f > $%.2f"
                        .formatted(monthlySpend, estimatedCost, monthlyBudget));
            }
            return BudgetCheck.ok();
        } finally {
            lock.unlock();
        }
    }

    public CostStatus getStatus() {
        lock.lock();
        try {
            rolloverIfNeeded();
            return new CostStatus(
                    dailySpend, dailyBudget, dailyBudget - dailySpend, percent(dailySpend, dailyBudget),
                    monthlySpend, monthlyBudget, monthlyBudget - monthlySpend, percent(monthlySpend, monthlyBudget),
                    totalSpend, requestCount, tokenCount);
        } finally {
            lock.unlock();
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Caller holds the lock. */
    private void rolloverIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(lastDailyReset)) {
            log.info("[CostTracker] New day {}: daily spend ${} cleared", today, "%.4f".formatted(dailySpend));
            dailySpend = 0;
            lastDailyReset = today;
        }
        YearMonth month = YearMonth.from(today);
        if (!month.equals(lastMonthlyReset)) {
            log.info("[CostTracker] New month {}: monthly spend ${} cleared", month, "%.4f".formatted(monthlySpend));
            monthlySpend = 0;
            lastMonthlyReset = month;
        }
    }

    private static double percent(double spend, double budget) {
        return budget > 0 ? (spend / budget) * 100.0 : 0.0;
    }
}
