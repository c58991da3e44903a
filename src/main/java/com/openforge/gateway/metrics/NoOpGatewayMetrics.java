package com.openforge.gateway.metrics;

import java.time.Duration;

/** Discards everything. */
public final class NoOpGatewayMetrics implements GatewayMetrics {

    public static final NoOpGatewayMetrics INSTANCE = new NoOpGatewayMetrics();

    @Override
    public void recordRequest(String backend, String model, String agentId, String cacheStatus, Duration duration) {
    }

    @Override
    public void recordCost(String backend, String model, double usd) {
    }

    @Override
    public void recordTokens(String kind, String backend, String model, long count) {
    }

    @Override
    public void updateCacheHitRate(String agentId, double ratio) {
    }

    @Override
    public void recordProviderError(String backend) {
    }
}
