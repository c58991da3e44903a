package com.openforge.gateway.cost;

/**
 * Point-in-time view of the ledger, derived on every read.
 * Percent fields are 0 when the matching budget is not configured.
 */
public record CostStatus(
        double dailySpend,
        double dailyBudget,
        double dailyRemaining,
        double dailyPercent,
        double monthlySpend,
        double monthlyBudget,
        double monthlyRemaining,
        double monthlyPercent,
        double totalSpend,
        long requestCount,
        long tokenCount
) {}
