package com.openforge.gateway.agent;

import lombok.Builder;

/**
 * Read-only per-agent settings handed to the routers.
 *
 * @param complexityThreshold hybrid agents route to cloud when the request's
 *                            complexity score is at or above this value
 * @param latencyBudgetMs     informational; not enforced by the routing layer
 * @param requestsPerMinute   registry-side admission limit, 0 = unlimited
 */
@Builder(toBuilder = true)
public record AgentConfig(
        String id,
        String name,
        ModelTier tier,
        String defaultModel,
        int maxTokens,
        double temperature,
        double complexityThreshold,
        long latencyBudgetMs,
        int requestsPerMinute
) {

    public static final double DEFAULT_COMPLEXITY_THRESHOLD = 0.5;

    /** The settings an agent gets when nothing is registered under its id. */
    public static AgentConfig defaults(String agentId) {
        return AgentConfig.builder()
                .id(agentId)
                .name(agentId)
                .tier(ModelTier.HYBRID)
                .complexityThreshold(DEFAULT_COMPLEXITY_THRESHOLD)
                .build();
    }
}
