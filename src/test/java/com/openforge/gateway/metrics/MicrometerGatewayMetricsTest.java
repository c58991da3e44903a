package com.openforge.gateway.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerGatewayMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerGatewayMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerGatewayMetrics(registry);
    }

    @Test
    void requestsShouldBeTimedPerBackendAndCacheStatus() {
        metrics.recordRequest("OpenAI", "gpt-4o", "researcher", GatewayMetrics.CACHE_MISS, Duration.ofMillis(120));
        metrics.recordRequest("openai", "gpt-4o", "researcher", GatewayMetrics.CACHE_MISS, Duration.ofMillis(80));

        Timer timer = registry.get("gateway.requests")
                .tags("backend", "openai", "model", "gpt-4o", "agent_id", "researcher", "cache", "miss")
                .timer();
        assertEquals(2, timer.count());
        assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void costAndTokensShouldAccumulate() {
        metrics.recordCost("anthropic", "claude-3-haiku", 0.25);
        metrics.recordCost("anthropic", "claude-3-haiku", 0.50);
        metrics.recordTokens(GatewayMetrics.TOKENS_PROMPT, "anthropic", "claude-3-haiku", 100);
        metrics.recordTokens(GatewayMetrics.TOKENS_COMPLETION, "anthropic", "claude-3-haiku", 40);

        assertEquals(0.75, registry.get("gateway.cost.usd").counter().count(), 0.0001);
        assertEquals(100.0, registry.get("gateway.tokens").tag("kind", "prompt").counter().count(), 0.0001);
        assertEquals(40.0, registry.get("gateway.tokens").tag("kind", "completion").counter().count(), 0.0001);
    }

    @Test
    void hitRateGaugeShouldTrackLatestValuePerAgent() {
        metrics.updateCacheHitRate("researcher", 0.25);
        metrics.updateCacheHitRate("researcher", 0.5);
        metrics.updateCacheHitRate(null, 1.0);

        Gauge researcher = registry.get("gateway.cache.hit.ratio").tag("agent_id", "researcher").gauge();
        assertEquals(0.5, researcher.value(), 0.0001);
        assertEquals(1.0, registry.get("gateway.cache.hit.ratio").tag("agent_id", "none").gauge().value(), 0.0001);
    }

    @Test
    void providerErrorsShouldBeCountedWithBlankBackendAsNone() {
        metrics.recordProviderError("ollama");
        metrics.recordProviderError("  ");

        assertEquals(1.0, registry.get("gateway.provider.errors").tag("backend", "ollama").counter().count());
        assertEquals(1.0, registry.get("gateway.provider.errors").tag("backend", "none").counter().count());
    }
}
