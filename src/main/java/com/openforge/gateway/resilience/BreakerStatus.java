package com.openforge.gateway.resilience;

import java.time.Instant;

/**
 * Point-in-time copy of one breaker's counters, taken under its lock.
 */
public record BreakerStatus(
        String backendId,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailure,
        int failureThreshold,
        long resetTimeoutMs
) {}
