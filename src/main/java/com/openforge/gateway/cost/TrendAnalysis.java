package com.openforge.gateway.cost;

public record TrendAnalysis(
        TrendMetrics last1Hour,
        TrendMetrics last24Hours,
        TrendMetrics last7Days
) {}
