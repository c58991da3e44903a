package com.openforge.gateway.web.dto;

import com.openforge.gateway.resilience.FailoverBackend;
import com.openforge.gateway.routing.RouterMetrics;

import java.util.List;

/** Response of GET /v1/admin/router. */
public record RouterInfo(
        String strategy,
        List<String> backends,
        RouterMetrics.Snapshot counters,
        CacheInfo cache,
        FailoverBackend.FailoverStats failover
) {

    public record CacheInfo(boolean enabled, int size, long hits, long misses, double hitRate) {}
}
