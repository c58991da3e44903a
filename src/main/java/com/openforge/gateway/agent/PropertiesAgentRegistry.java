package com.openforge.gateway.agent;

import com.openforge.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent registry backed by the "gateway.agents" configuration block.
 *
 * Admission control is a fixed one-minute window per agent: the counter
 * resets when the wall-clock minute changes.  Agents with
 * requestsPerMinute = 0 (and unknown agents) are never limited.
 */
@Slf4j
public class PropertiesAgentRegistry implements AgentRegistry {

    private final Map<String, AgentConfig> agents = new ConcurrentHashMap<>();
    private final Map<String, Window>      windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public PropertiesAgentRegistry(Map<String, GatewayProperties.AgentProperties> configured, Clock clock) {
        this.clock = clock;
        configured.forEach((id, props) -> register(toConfig(id, props)));
    }

    public void register(AgentConfig config) {
        agents.put(config.id(), config);
        log.info("[AgentRegistry] Registered agent {} tier={} defaultModel={}",
                config.id(), config.tier(), config.defaultModel());
    }

    @Override
    public AgentConfig get(String agentId) {
        AgentConfig config = agents.get(agentId);
        return config != null ? config : AgentConfig.defaults(agentId);
    }

    @Override
    public boolean allow(String agentId) {
        int limit = get(agentId).requestsPerMinute();
        if (limit <= 0) {
            return true;
        }
        long minute = clock.millis() / 60_000L;
        Window window = windows.computeIfAbsent(agentId, k -> new Window());
        synchronized (window) {
            if (window.minute != minute) {
                window.minute = minute;
                window.count = 0;
            }
            if (window.count >= limit) {
                return false;
            }
            window.count++;
            return true;
        }
    }

    @Override
    public List<String> list() {
        return agents.keySet().stream().sorted().toList();
    }

    private static AgentConfig toConfig(String id, GatewayProperties.AgentProperties p) {
        return AgentConfig.builder()
                .id(id)
                .name(p.name() != null ? p.name() : id)
                .tier(p.tier() != null ? p.tier() : ModelTier.HYBRID)
                .defaultModel(p.defaultModel())
                .maxTokens(p.maxTokens())
                .temperature(p.temperature())
                .complexityThreshold(p.complexityThreshold())
                .latencyBudgetMs(p.latencyBudgetMs())
                .requestsPerMinute(p.requestsPerMinute())
                .build();
    }

    private static final class Window {
        long minute = -1;
        int  count;
    }
}
