package com.openforge.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.gateway.agent.AgentRegistry;
import com.openforge.gateway.agent.PropertiesAgentRegistry;
import com.openforge.gateway.cache.ResponseCache;
import com.openforge.gateway.cost.CostAnalytics;
import com.openforge.gateway.cost.CostSnapshotJob;
import com.openforge.gateway.cost.CostTracker;
import com.openforge.gateway.metrics.GatewayMetrics;
import com.openforge.gateway.metrics.MicrometerGatewayMetrics;
import com.openforge.gateway.metrics.NoOpGatewayMetrics;
import com.openforge.gateway.resilience.FailoverBackend;
import com.openforge.gateway.routing.AbstractRouter;
import com.openforge.gateway.routing.CloudOnlyRouter;
import com.openforge.gateway.routing.FailoverRouter;
import com.openforge.gateway.routing.RouterContext;
import com.openforge.gateway.routing.StaticRouter;
import com.openforge.gateway.routing.TierRouter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Assembles the routing layer from {@link GatewayProperties}.
 *
 *   BackendCatalog  (one CircuitBreaker per configured backend)
 *     ├─ FailoverBackend  (breakers in gateway.failover.order)
 *     └─ gatewayRouter    (static | tier | cloud | failover)
 *          ├─ AgentRegistry
 *          ├─ ResponseCache  (when gateway.cache.enabled)
 *          ├─ CostTracker ── CostAnalytics ── CostSnapshotJob (@Scheduled)
 *          └─ GatewayMetrics (Micrometer when a MeterRegistry is present)
 */
@Slf4j
@Configuration
@EnableScheduling
public class GatewayConfig {

    @Bean
    public BackendCatalog backendCatalog(GatewayProperties properties,
                                         HttpClient httpClient,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        return BackendCatalog.fromProperties(properties, httpClient, objectMapper, clock);
    }

    @Bean
    public FailoverBackend failoverBackend(BackendCatalog catalog, GatewayProperties properties) {
        return new FailoverBackend(catalog.ordered(properties.failover().order()));
    }

    @Bean
    public AgentRegistry agentRegistry(GatewayProperties properties, Clock clock) {
        return new PropertiesAgentRegistry(properties.agents(), clock);
    }

    @Bean
    public CostTracker costTracker(GatewayProperties properties, Clock clock) {
        GatewayProperties.CostProperties cost = properties.cost();
        return new CostTracker(cost.dailyBudgetUsd(), cost.monthlyBudgetUsd(), clock);
    }

    @Bean
    public CostAnalytics costAnalytics(CostTracker costTracker, GatewayProperties properties, Clock clock) {
        GatewayProperties.CostProperties cost = properties.cost();
        return new CostAnalytics(costTracker, cost.maxHistorySize(), cost.snapshotInterval(), clock);
    }

    @Bean
    public CostSnapshotJob costSnapshotJob(CostAnalytics costAnalytics) {
        return new CostSnapshotJob(costAnalytics);
    }

    @Bean
    public ResponseCache responseCache(Clock clock) {
        return new ResponseCache(clock);
    }

    @Bean
    public GatewayMetrics gatewayMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("[GatewayConfig] No MeterRegistry available; gateway metrics disabled");
            return NoOpGatewayMetrics.INSTANCE;
        }
        return new MicrometerGatewayMetrics(registry);
    }

    @Bean
    public AbstractRouter gatewayRouter(GatewayProperties properties,
                                        BackendCatalog catalog,
                                        FailoverBackend failoverBackend,
                                        AgentRegistry agentRegistry,
                                        CostTracker costTracker,
                                        ResponseCache responseCache,
                                        GatewayMetrics gatewayMetrics) {
        GatewayProperties.CacheProperties cache = properties.cache();
        RouterContext context = RouterContext.builder()
                .registry(agentRegistry)
                .costTracker(costTracker)
                .cache(cache.enabled() ? responseCache : null)
                .cacheTtl(cache.enabled() ? cache.ttl() : Duration.ZERO)
                .metrics(gatewayMetrics)
                .build();

        String strategy = properties.strategy() == null ? TierRouter.STRATEGY
                : properties.strategy().trim().toLowerCase(Locale.ROOT);
        return switch (strategy) {
            case StaticRouter.STRATEGY -> new StaticRouter(context, catalog.all());
            case TierRouter.STRATEGY -> new TierRouter(context, catalog.local().orElse(null), catalog.cloud());
            case CloudOnlyRouter.STRATEGY -> new CloudOnlyRouter(context, catalog.cloud(),
                    catalog.cloud().get(properties.defaultCloudBackend()));
            case FailoverRouter.STRATEGY -> new FailoverRouter(context, failoverBackend);
            default -> throw new IllegalStateException(
                    "Unknown gateway.strategy '%s' (expected static, tier, cloud or failover)"
                            .formatted(properties.strategy()));
        };
    }
}
