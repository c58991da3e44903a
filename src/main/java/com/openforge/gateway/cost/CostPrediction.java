package com.openforge.gateway.cost;

/**
 * Linear end-of-month projection.
 *
 * @param confidence 0.0 – 1.0, grows with days observed and snapshots held
 */
public record CostPrediction(
        double predictedMonthlyTotal,
        double currentMonthlySpend,
        double daysElapsed,
        double daysRemaining,
        double dailyAverage,
        double confidence,
        boolean willExceedBudget,
        double percentOfBudget,
        double monthlyBudget
) {}
