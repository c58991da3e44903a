package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentRegistry;
import com.openforge.gateway.cache.ResponseCache;
import com.openforge.gateway.cost.CostTracker;
import com.openforge.gateway.metrics.GatewayMetrics;
import lombok.Builder;

import java.time.Duration;

/**
 * Collaborators shared by every routing strategy.
 *
 * Only {@code registry} is mandatory.  A null cache (or a non-positive TTL)
 * disables caching, a null ledger disables cost tracking, and a null metrics
 * hook falls back to the no-op implementation.
 */
@Builder
public record RouterContext(
        AgentRegistry registry,
        CostTracker costTracker,
        ResponseCache cache,
        Duration cacheTtl,
        GatewayMetrics metrics
) {

    public boolean cacheEnabled() {
        return cache != null && cacheTtl != null && !cacheTtl.isZero() && !cacheTtl.isNegative();
    }
}
