package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.agent.AgentRegistry;
import com.openforge.gateway.cache.CacheKeys;
import com.openforge.gateway.cache.ResponseCache;
import com.openforge.gateway.cost.CostTracker;
import com.openforge.gateway.llm.AllBackendsFailedException;
import com.openforge.gateway.llm.BackendException;
import com.openforge.gateway.llm.BreakerOpenException;
import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.NoBackendAvailableException;
import com.openforge.gateway.llm.StreamCancelledException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;
import com.openforge.gateway.metrics.GatewayMetrics;
import com.openforge.gateway.metrics.NoOpGatewayMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Request pipeline shared by every routing strategy.  Subclasses only decide
 * which backend serves a request.
 *
 * Call graph:
 *
 *   complete(request)
 *     └─ registry.get(agentId)             unknown agents get defaults
 *     └─ request.withDefaults(agent)       only unset fields are filled
 *     └─ cache.get(key)                    hit → return, no backend call
 *     └─ selectRoute(request, agent)       strategy-specific
 *     └─ backend.complete(routed request)  failures → BackendException
 *     └─ costTracker.trackUsage(response)  problems logged, never fatal
 *     └─ cache.put(key, response, ttl)
 *
 *   stream(token, request, emit)
 *     └─ same agent lookup, defaults and selection; no cache, no ledger
 *
 * The cache key is built from the request after defaults are applied, so a
 * call that omits the model shares entries with one that names the agent's
 * default model explicitly.
 */
@Slf4j
public abstract class AbstractRouter implements LlmBackend {

    protected final AgentRegistry  registry;
    protected final CostTracker    costTracker;
    protected final ResponseCache  cache;
    protected final Duration       cacheTtl;
    protected final GatewayMetrics metrics;
    protected final RouterMetrics  routerMetrics = new RouterMetrics();
    private   final boolean        cacheEnabled;

    protected AbstractRouter(RouterContext context) {
        if (context == null || context.registry() == null) {
            throw new IllegalArgumentException("agent registry is required");
        }
        this.registry     = context.registry();
        this.costTracker  = context.costTracker();
        this.cache        = context.cache();
        this.cacheTtl     = context.cacheTtl();
        this.metrics      = context.metrics() != null ? context.metrics() : NoOpGatewayMetrics.INSTANCE;
        this.cacheEnabled = context.cacheEnabled();
    }

    // ── Strategy hooks ───────────────────────────────────────────────────────

    /**
     * Picks the backend for a request whose agent defaults are already applied.
     *
     * @throws NoBackendAvailableException when nothing registered can serve it
     */
    protected abstract Route selectRoute(CompletionRequest request, AgentConfig agent);

    /** Short strategy name: static, tier, cloud. */
    public abstract String strategy();

    /** Ids of every backend this router can select, in priority order. */
    public abstract List<String> backendIds();

    // ── LlmBackend ───────────────────────────────────────────────────────────

    @Override
    public String id() {
        return strategy() + "-router";
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        long started = System.nanoTime();
        routerMetrics.call();

        AgentConfig agent = registry.get(request.agentId());
        CompletionRequest effective = applyDefaults(request, agent);

        String cacheKey = null;
        if (cacheEnabled) {
            cacheKey = CacheKeys.of(effective);
            Optional<CompletionResponse> cached = lookup(cacheKey);
            if (cached.isPresent()) {
                routerMetrics.cacheHit();
                CompletionResponse hit = cached.get();
                log.debug("[{}] Cache hit for agent {} model {}", id(), agent.id(), effective.model());
                metrics.recordRequest(hit.provider(), effective.model(), agent.id(),
                        GatewayMetrics.CACHE_HIT, elapsedSince(started));
                metrics.updateCacheHitRate(agent.id(), cache.hitRate());
                return hit;
            }
        }

        Route route = select(effective, agent);
        LlmBackend backend = route.backend();
        CompletionResponse response;
        try {
            response = backend.complete(route.request());
        } catch (BreakerOpenException | AllBackendsFailedException | NoBackendAvailableException e) {
            routerMetrics.error();
            throw e;
        } catch (RuntimeException e) {
            routerMetrics.error();
            metrics.recordProviderError(backend.id());
            log.warn("[{}] Backend {} failed for agent {}: {}", id(), backend.id(), agent.id(), e.getMessage());
            throw new BackendException(backend.id(), e);
        }
        countTier(route);

        trackCost(backend.id(), response);
        if (cacheKey != null) {
            store(cacheKey, response);
        }

        String cacheStatus = cacheEnabled ? GatewayMetrics.CACHE_MISS : GatewayMetrics.CACHE_DISABLED;
        metrics.recordRequest(backend.id(), response.model(), agent.id(), cacheStatus, elapsedSince(started));
        if (cacheEnabled) {
            metrics.updateCacheHitRate(agent.id(), cache.hitRate());
        }
        return response;
    }

    @Override
    public void stream(CancellationToken token, CompletionRequest request, Consumer<CompletionChunk> emit) {
        long started = System.nanoTime();
        routerMetrics.call();

        AgentConfig agent = registry.get(request.agentId());
        CompletionRequest effective = applyDefaults(request, agent);

        Route route;
        try {
            route = select(effective, agent);
        } catch (NoBackendAvailableException e) {
            emit.accept(CompletionChunk.failed(effective.model(), id(), e.getMessage()));
            throw e;
        }

        LlmBackend backend = route.backend();
        try {
            backend.stream(token, route.request(), emit);
        } catch (StreamCancelledException e) {
            log.debug("[{}] Stream for agent {} cancelled by caller", id(), agent.id());
            throw e;
        } catch (BreakerOpenException | AllBackendsFailedException e) {
            routerMetrics.error();
            throw e;
        } catch (RuntimeException e) {
            routerMetrics.error();
            metrics.recordProviderError(backend.id());
            throw new BackendException(backend.id(), e);
        }
        countTier(route);
        metrics.recordRequest(backend.id(), route.request().model(), agent.id(),
                GatewayMetrics.CACHE_DISABLED, elapsedSince(started));
    }

    // ── Inspection ───────────────────────────────────────────────────────────

    /** The key {@link #complete} would use for this request. */
    public String buildCacheKey(CompletionRequest request) {
        return CacheKeys.of(applyDefaults(request, registry.get(request.agentId())));
    }

    public RouterMetrics.Snapshot metrics() {
        return routerMetrics.snapshot();
    }

    public boolean cacheEnabled() {
        return cacheEnabled;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static CompletionRequest applyDefaults(CompletionRequest request, AgentConfig agent) {
        return request.withDefaults(agent.defaultModel(), agent.maxTokens(), agent.temperature());
    }

    private Route select(CompletionRequest request, AgentConfig agent) {
        Route route = selectRoute(request, agent);
        log.debug("[{}] agent={} model={} → {}", id(), agent.id(), request.model(), route.backend().id());
        return route;
    }

    private void countTier(Route route) {
        if (route.local()) {
            routerMetrics.local();
        } else {
            routerMetrics.cloud();
        }
    }

    private Optional<CompletionResponse> lookup(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("[{}] Cache lookup failed, treating as miss: {}", id(), e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String key, CompletionResponse response) {
        try {
            cache.put(key, response, cacheTtl);
        } catch (RuntimeException e) {
            log.warn("[{}] Cache store failed: {}", id(), e.getMessage());
        }
    }

    private void trackCost(String backendId, CompletionResponse response) {
        if (costTracker == null) {
            return;
        }
        try {
            double cost = costTracker.trackUsage(response);
            CompletionResponse.Usage usage = response.usage();
            metrics.recordCost(backendId, response.model(), cost);
            metrics.recordTokens(GatewayMetrics.TOKENS_PROMPT, backendId, response.model(), usage.promptTokens());
            metrics.recordTokens(GatewayMetrics.TOKENS_COMPLETION, backendId, response.model(),
                    usage.completionTokens());
        } catch (RuntimeException e) {
            log.warn("[{}] Cost tracking failed for model {}: {}", id(), response.model(), e.getMessage());
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
