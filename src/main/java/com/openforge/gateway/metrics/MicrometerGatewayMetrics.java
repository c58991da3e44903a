package com.openforge.gateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer-backed metrics, exposed through the actuator endpoints.
 *
 * <p>Tags stay low-cardinality: backend, model, agent and a small fixed set of
 * statuses/kinds.  Tag values are trimmed and lower-cased.
 */
public final class MicrometerGatewayMetrics implements GatewayMetrics {

    private final MeterRegistry registry;

    private final ConcurrentHashMap<String, AtomicReference<Double>> hitRates = new ConcurrentHashMap<>();

    public MicrometerGatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRequest(String backend, String model, String agentId, String cacheStatus, Duration duration) {
        Timer.builder("gateway.requests")
                .description("Routed completion requests")
                .tag("backend", safeTag(backend))
                .tag("model", safeTag(model))
                .tag("agent_id", safeTag(agentId))
                .tag("cache", safeTag(cacheStatus))
                .register(registry)
                .record(duration);
    }

    @Override
    public void recordCost(String backend, String model, double usd) {
        Counter.builder("gateway.cost.usd")
                .description("Spend attributed to completions")
                .baseUnit("usd")
                .tag("backend", safeTag(backend))
                .tag("model", safeTag(model))
                .register(registry)
                .increment(usd);
    }

    @Override
    public void recordTokens(String kind, String backend, String model, long count) {
        Counter.builder("gateway.tokens")
                .tag("kind", safeTag(kind))
                .tag("backend", safeTag(backend))
                .tag("model", safeTag(model))
                .register(registry)
                .increment(count);
    }

    @Override
    public void updateCacheHitRate(String agentId, double ratio) {
        String agent = safeTag(agentId);
        hitRates.computeIfAbsent(agent, a -> {
            AtomicReference<Double> holder = new AtomicReference<>(0.0);
            Gauge.builder("gateway.cache.hit.ratio", holder, AtomicReference::get)
                    .tag("agent_id", a)
                    .register(registry);
            return holder;
        }).set(ratio);
    }

    @Override
    public void recordProviderError(String backend) {
        Counter.builder("gateway.provider.errors")
                .tag("backend", safeTag(backend))
                .register(registry)
                .increment();
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
