package com.openforge.gateway.cost;

import java.time.Instant;

/**
 * Immutable copy of the ledger's core figures at one instant.
 */
public record CostSnapshot(
        Instant timestamp,
        double dailySpend,
        double monthlySpend,
        double totalSpend,
        long requestCount,
        long tokenCount
) {

    public static CostSnapshot of(Instant timestamp, CostStatus status) {
        return new CostSnapshot(timestamp, status.dailySpend(), status.monthlySpend(),
                status.totalSpend(), status.requestCount(), status.tokenCount());
    }
}
