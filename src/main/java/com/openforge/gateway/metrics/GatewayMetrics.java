package com.openforge.gateway.metrics;

import java.time.Duration;

/**
 * Hook points the routing layer reports into.
 *
 * Implementations must be cheap and must not throw; {@link NoOpGatewayMetrics}
 * can always be substituted.
 */
public interface GatewayMetrics {

    String CACHE_HIT      = "hit";
    String CACHE_MISS     = "miss";
    String CACHE_DISABLED = "disabled";

    String TOKENS_PROMPT     = "prompt";
    String TOKENS_COMPLETION = "completion";

    void recordRequest(String backend, String model, String agentId, String cacheStatus, Duration duration);

    void recordCost(String backend, String model, double usd);

    void recordTokens(String kind, String backend, String model, long count);

    void updateCacheHitRate(String agentId, double ratio);

    void recordProviderError(String backend);
}
