package com.openforge.gateway.web;

import com.openforge.gateway.cache.ResponseCache;
import com.openforge.gateway.config.BackendCatalog;
import com.openforge.gateway.cost.CostTracker;
import com.openforge.gateway.resilience.BreakerStatus;
import com.openforge.gateway.resilience.CircuitBreaker;
import com.openforge.gateway.resilience.FailoverBackend;
import com.openforge.gateway.routing.AbstractRouter;
import com.openforge.gateway.web.dto.RouterInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Operator endpoints.
 *
 *   GET  /v1/admin/breakers                   state of every backend's breaker
 *   POST /v1/admin/breakers/{backendId}/reset
 *   GET  /v1/admin/router                     strategy, counters, cache and failover stats
 *   POST /v1/admin/cache/clear
 *   POST /v1/admin/costs/reset
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final BackendCatalog  backendCatalog;
    private final FailoverBackend failoverBackend;
    private final AbstractRouter  gatewayRouter;
    private final ResponseCache   responseCache;
    private final CostTracker     costTracker;

    @GetMapping("/breakers")
    public List<BreakerStatus> breakers() {
        return backendCatalog.statuses();
    }

    @PostMapping("/breakers/{backendId}/reset")
    public BreakerStatus resetBreaker(@PathVariable String backendId) {
        if (!backendCatalog.resetBreaker(backendId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown backend: " + backendId);
        }
        log.info("[Admin] Breaker for {} reset", backendId);
        return backendCatalog.find(backendId).map(CircuitBreaker::snapshot).orElseThrow();
    }

    @GetMapping("/router")
    public RouterInfo router() {
        RouterInfo.CacheInfo cache = new RouterInfo.CacheInfo(gatewayRouter.cacheEnabled(),
                responseCache.size(), responseCache.hits(), responseCache.misses(), responseCache.hitRate());
        return new RouterInfo(gatewayRouter.strategy(), gatewayRouter.backendIds(),
                gatewayRouter.metrics(), cache, failoverBackend.stats());
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Void> clearCache() {
        responseCache.clear();
        log.info("[Admin] Response cache cleared");
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/costs/reset")
    public ResponseEntity<Void> resetCosts() {
        costTracker.reset();
        return ResponseEntity.noContent().build();
    }
}
