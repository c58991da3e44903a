package com.openforge.gateway.cost;

/**
 * A spending alert, computed on demand and never stored.
 *
 * @param level     info | warning | critical
 * @param type      e.g. daily_budget_75, monthly_budget_exceeded, predicted_budget_exceeded
 * @param percent   percentage of budget used (or predicted)
 * @param spend     current (or predicted) spend
 * @param threshold the percentage that triggered the alert
 */
public record CostAlert(
        String level,
        String type,
        String message,
        double percent,
        double spend,
        double budget,
        double threshold
) {

    public static final String INFO     = "info";
    public static final String WARNING  = "warning";
    public static final String CRITICAL = "critical";
}
