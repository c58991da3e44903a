package com.openforge.gateway.cost;

/**
 * Change between the earliest and latest snapshot of one time window.
 * All zero when the window holds no snapshot.
 */
public record TrendMetrics(
        double spendChange,
        long requestChange,
        long tokenChange,
        double durationHours,
        double avgSpendPerHour,
        double avgRequestsPerHour
) {

    public static final TrendMetrics EMPTY = new TrendMetrics(0, 0, 0, 0, 0, 0);
}
