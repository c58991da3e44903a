package com.openforge.gateway.config;

import com.openforge.gateway.agent.AgentRegistry;
import com.openforge.gateway.resilience.FailoverBackend;
import com.openforge.gateway.routing.AbstractRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reported:
 *   - Routing: active strategy, backends it can select, cache settings
 *   - Backends: base URL, default model and masked API key of each entry
 *   - Budgets: daily / monthly limits and snapshot cadence
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final GatewayProperties properties;
    private final AbstractRouter    gatewayRouter;
    private final FailoverBackend   failoverBackend;
    private final AgentRegistry     agentRegistry;
    private final Environment       env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        String backends = properties.backends().isEmpty()
                ? "    (none configured)"
                : properties.backends().stream()
                        .map(b -> "    %-12s %s  model=%s  key=%s  %s".formatted(
                                b.id(), b.baseUrl(), b.defaultModel(), maskKey(b.apiKey()),
                                b.cloud() ? "cloud" : "local"))
                        .collect(Collectors.joining("\n"));

        GatewayProperties.CostProperties cost = properties.cost();
        GatewayProperties.CacheProperties cache = properties.cache();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              LLM Gateway  -  Startup Summary             ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Routing                                                 ║
                ║    Strategy       : {}  backends={}
                ║    Failover chain : {}
                ║    Cache          : {}  ttl={}
                ║    Agents         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Backends                                                ║
                {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Budgets                                                 ║
                ║    Daily          : {}
                ║    Monthly        : {}
                ║    Snapshots      : every {}  keep={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                gatewayRouter.strategy(), gatewayRouter.backendIds(),
                failoverBackend.breakerStatuses().stream().map(s -> s.backendId()).toList(),
                cache.enabled() ? "✔ enabled" : "✘ disabled", cache.ttl(),
                agentRegistry.list(),

                backends,

                budget(cost.dailyBudgetUsd()),
                budget(cost.monthlyBudgetUsd()),
                cost.snapshotInterval(), cost.maxHistorySize()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String budget(double usd) {
        return usd > 0 ? "$%.2f".formatted(usd) : "unlimited";
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" for blank keys.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
