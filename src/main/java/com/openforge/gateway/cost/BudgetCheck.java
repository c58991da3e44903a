package com.openforge.gateway.cost;

/**
 * Outcome of {@link CostTracker#checkBudget}.  {@code reason} is null when allowed.
 */
public record BudgetCheck(boolean allowed, String reason) {

    public static BudgetCheck ok() {
        return new BudgetCheck(true, null);
    }

    public static BudgetCheck denied(String reason) {
        return new BudgetCheck(false, reason);
    }
}
