package com.openforge.gateway.cost;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Snapshot history of the {@link CostTracker} with trends, a month-end
 * projection and threshold alerts.
 *
 * There is no timer in here.  {@link #recordSnapshot()} is driven from
 * outside ({@link CostSnapshotJob} in the running service) and is a no-op
 * when called again before {@code snapshotInterval} has passed.  History is
 * oldest-first and capped at {@code maxHistorySize}.
 */
@Slf4j
public class CostAnalytics {

    public static final int      DEFAULT_MAX_HISTORY_SIZE  = 1440;
    public static final Duration DEFAULT_SNAPSHOT_INTERVAL = Duration.ofMinutes(1);

    /** Snapshot count at which the history part of the confidence saturates. */
    static final double FULL_HISTORY = 1440.0;
    /** Days observed at which the calendar part of the confidence saturates. */
    static final double FULL_DAYS    = 7.0;

    private static final List<AlertRule> DAILY_RULES = List.of(
            new AlertRule(100, CostAlert.CRITICAL, "daily_budget_exceeded", "Daily budget exceeded"),
            new AlertRule(90,  CostAlert.WARNING,  "daily_budget_90",       "Daily budget at 90%"),
            new AlertRule(75,  CostAlert.INFO,     "daily_budget_75",       "Daily budget at 75%"));

    private static final List<AlertRule> MONTHLY_RULES = List.of(
            new AlertRule(100, CostAlert.CRITICAL, "monthly_budget_exceeded", "Monthly budget exceeded"),
            new AlertRule(90,  CostAlert.WARNING,  "monthly_budget_90",       "Monthly budget at 90%"),
            new AlertRule(75,  CostAlert.INFO,     "monthly_budget_75",       "Monthly budget at 75%"),
            new AlertRule(50,  CostAlert.INFO,     "monthly_budget_50",       "Monthly budget at 50%"));

    private final CostTracker tracker;
    private final int         maxHistorySize;
    private final Duration    snapshotInterval;
    private final Clock       clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<CostSnapshot> history = new ArrayDeque<>();
    private Instant lastSnapshot;

    public CostAnalytics(CostTracker tracker, int maxHistorySize, Duration snapshotInterval, Clock clock) {
        this.tracker          = tracker;
        this.maxHistorySize   = maxHistorySize > 0 ? maxHistorySize : DEFAULT_MAX_HISTORY_SIZE;
        this.snapshotInterval = snapshotInterval != null && !snapshotInterval.isZero() && !snapshotInterval.isNegative()
                ? snapshotInterval : DEFAULT_SNAPSHOT_INTERVAL;
        this.clock            = clock;
        this.lastSnapshot     = clock.instant();
    }

    // ── History ──────────────────────────────────────────────────────────────

    /**
     * Appends a snapshot of the ledger unless the previous one is younger than
     * the snapshot interval.
     *
     * @return true when a snapshot was taken
     */
    public boolean recordSnapshot() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (Duration.between(lastSnapshot, now).compareTo(snapshotInterval) < 0) {
                return false;
            }
            history.addLast(CostSnapshot.of(now, tracker.getStatus()));
            lastSnapshot = now;
            while (history.size() > maxHistorySize) {
                history.removeFirst();
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Snapshots taken at or after {@code since}, oldest first. */
    public List<CostSnapshot> getHistoricalData(Instant since) {
        lock.readLock().lock();
        try {
            return filterSince(since);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int historySize() {
        lock.readLock().lock();
        try {
            return history.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Trends ───────────────────────────────────────────────────────────────

    public TrendAnalysis getTrends() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            return new TrendAnalysis(
                    trendOf(filterSince(now.minus(Duration.ofHours(1)))),
                    trendOf(filterSince(now.minus(Duration.ofHours(24)))),
                    trendOf(filterSince(now.minus(Duration.ofDays(7)))));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Prediction ───────────────────────────────────────────────────────────

    public CostPrediction predictMonthlyCost() {
        lock.readLock().lock();
        try {
            return predict(tracker.getStatus(), history.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Alerts ───────────────────────────────────────────────────────────────

    /**
     * Every threshold is checked on its own, so one status can raise several
     * alerts for the same period (e.g. 95 % daily gives both the 90 and the
     * 75 alert).
     */
    public List<CostAlert> getAlerts() {
        CostStatus status = tracker.getStatus();
        List<CostAlert> alerts = new ArrayList<>();

        if (status.dailyBudget() > 0) {
            for (AlertRule rule : DAILY_RULES) {
                if (status.dailyPercent() >= rule.threshold()) {
                    alerts.add(rule.toAlert(status.dailyPercent(), status.dailySpend(), status.dailyBudget()));
                }
            }
        }

        if (status.monthlyBudget() > 0) {
            for (AlertRule rule : MONTHLY_RULES) {
                if (status.monthlyPercent() >= rule.threshold()) {
                    alerts.add(rule.toAlert(status.monthlyPercent(), status.monthlySpend(), status.monthlyBudget()));
                }
            }
        }

        CostPrediction prediction;
        lock.readLock().lock();
        try {
            prediction = predict(status, history.size());
        } finally {
            lock.readLock().unlock();
        }
        if (prediction.willExceedBudget()) {
            alerts.add(new CostAlert(CostAlert.WARNING, "predicted_budget_exceeded",
                    "Predicted to exceed monthly budget",
                    prediction.percentOfBudget(), prediction.predictedMonthlyTotal(),
                    status.monthlyBudget(), 100));
        }

        if (!alerts.isEmpty()) {
            log.debug("[CostAnalytics] {} active alert(s): {}", alerts.size(),
                    alerts.stream().map(CostAlert::type).toList());
        }
        return alerts;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Caller holds a lock. */
    private List<CostSnapshot> filterSince(Instant since) {
        return history.stream()
                .filter(s -> !s.timestamp().isBefore(since))
                .toList();
    }

    private CostPrediction predict(CostStatus status, int historySize) {
        LocalDateTime now = LocalDateTime.now(clock);
        double daysInMonth   = YearMonth.from(now).lengthOfMonth();
        double daysElapsed   = now.getDayOfMonth() + now.getHour() / 24.0;
        double daysRemaining = daysInMonth - daysElapsed;

        double monthlySpend   = status.monthlySpend();
        double monthlyBudget  = status.monthlyBudget();
        double dailyAverage   = monthlySpend / daysElapsed;
        double predictedTotal = monthlySpend + dailyAverage * daysRemaining;

        boolean willExceed = monthlyBudget > 0 && predictedTotal > monthlyBudget;
        double percentOfBudget = monthlyBudget > 0 ? (predictedTotal / monthlyBudget) * 100.0 : 0.0;

        return new CostPrediction(predictedTotal, monthlySpend, daysElapsed, daysRemaining, dailyAverage,
                confidence(daysElapsed, historySize), willExceed, percentOfBudget, monthlyBudget);
    }

    static double confidence(double daysElapsed, int historySize) {
        double dayConfidence     = Math.min(daysElapsed / FULL_DAYS, 1.0);
        double historyConfidence = Math.min(historySize / FULL_HISTORY, 1.0);
        return dayConfidence * 0.7 + historyConfidence * 0.3;
    }

    static TrendMetrics trendOf(List<CostSnapshot> window) {
        if (window.isEmpty()) {
            return TrendMetrics.EMPTY;
        }
        List<CostSnapshot> sorted = window.stream()
                .sorted(Comparator.comparing(CostSnapshot::timestamp))
                .toList();
        CostSnapshot first = sorted.get(0);
        CostSnapshot last  = sorted.get(sorted.size() - 1);

        double spendChange   = last.totalSpend() - first.totalSpend();
        long   requestChange = last.requestCount() - first.requestCount();
        long   tokenChange   = last.tokenCount() - first.tokenCount();
        double hours = Duration.between(first.timestamp(), last.timestamp()).toMillis() / 3_600_000.0;

        // a single snapshot spans no time; report the change without a rate
        double spendPerHour    = hours > 0 ? spendChange / hours : 0.0;
        double requestsPerHour = hours > 0 ? requestChange / hours : 0.0;
        return new TrendMetrics(spendChange, requestChange, tokenChange, hours, spendPerHour, requestsPerHour);
    }

    private record AlertRule(double threshold, String level, String type, String message) {

        CostAlert toAlert(double percent, double spend, double budget) {
            return new CostAlert(level, type, message, percent, spend, budget, threshold);
        }
    }
}
