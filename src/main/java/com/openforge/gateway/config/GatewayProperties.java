package com.openforge.gateway.config;

import com.openforge.gateway.agent.ModelTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Externalised gateway configuration.
 *
 * Reads from application.yml under the "gateway" prefix:
 *
 * gateway:
 *   strategy: tier                 # static | tier | cloud | failover
 *   local-backend: ollama
 *   default-cloud-backend: openrouter
 *   cache:
 *     enabled: true
 *     ttl: 5m
 *   breaker:
 *     failure-threshold: 3
 *     reset-timeout: 60s
 *   cost:
 *     daily-budget-usd: 10
 *     monthly-budget-usd: 200
 *     snapshot-interval: 1m
 *     max-history-size: 1440
 *   failover:
 *     order: [openai, anthropic, openrouter]
 *   backends:
 *     - id: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       default-model: gpt-4o
 *       cloud: true
 *   agents:
 *     researcher:
 *       tier: hybrid
 *       default-model: anthropic/claude-3-haiku
 *       complexity-threshold: 0.5
 */
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
        @DefaultValue("tier") String strategy,
        @DefaultValue("ollama") String localBackend,
        @DefaultValue("openrouter") String defaultCloudBackend,
        @DefaultValue CacheProperties cache,
        @DefaultValue BreakerProperties breaker,
        @DefaultValue CostProperties cost,
        @DefaultValue FailoverProperties failover,
        List<BackendProperties> backends,
        Map<String, AgentProperties> agents
) {

    public GatewayProperties {
        backends = backends == null ? List.of() : List.copyOf(backends);
        agents = agents == null ? Map.of() : Map.copyOf(agents);
    }

    public record CacheProperties(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("5m") Duration ttl
    ) {}

    public record BreakerProperties(
            @DefaultValue("3") int failureThreshold,
            @DefaultValue("60s") Duration resetTimeout
    ) {}

    public record CostProperties(
            @DefaultValue("0") double dailyBudgetUsd,
            @DefaultValue("0") double monthlyBudgetUsd,
            @DefaultValue("1m") Duration snapshotInterval,
            @DefaultValue("1440") int maxHistorySize
    ) {}

    /** Backend ids in the order the failover strategy walks them; empty means declaration order. */
    public record FailoverProperties(
            List<String> order
    ) {

        public FailoverProperties {
            order = order == null ? List.of() : List.copyOf(order);
        }
    }

    public record BackendProperties(
            String id,
            String baseUrl,
            String apiKey,
            String defaultModel,
            @DefaultValue("120") int timeoutSeconds,
            @DefaultValue("true") boolean cloud
    ) {}

    public record AgentProperties(
            String name,
            @DefaultValue("HYBRID") ModelTier tier,
            String defaultModel,
            @DefaultValue("0") int maxTokens,
            @DefaultValue("0") double temperature,
            @DefaultValue("0.5") double complexityThreshold,
            @DefaultValue("0") long latencyBudgetMs,
            @DefaultValue("0") int requestsPerMinute
    ) {}
}
