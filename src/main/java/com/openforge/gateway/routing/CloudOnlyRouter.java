package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.model.CompletionRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.openforge.gateway.routing.BackendIds.ANTHROPIC;
import static com.openforge.gateway.routing.BackendIds.HUGGINGFACE;
import static com.openforge.gateway.routing.BackendIds.OPENAI;
import static com.openforge.gateway.routing.BackendIds.OPENROUTER;

/**
 * Cloud-only routing for deployments without a local model runtime.
 *
 * Vendor models prefer the aggregator:
 *
 *   anthropic/* claude-*   → openrouter if registered, else anthropic
 *   openai/* gpt-* o1-*    → openrouter if registered, else openai
 *   hf:*                   → huggingface
 *   other names with '/'   → openrouter
 *   everything else        → default backend
 *
 * Bare vendor names sent to the aggregator get the vendor namespace
 * ("claude-3-opus" → "anthropic/claude-3-opus"); namespaced names sent to
 * the vendor lose it.  Agent tier is ignored.
 */
@Slf4j
public class CloudOnlyRouter extends AbstractRouter {

    public static final String STRATEGY = "cloud";

    static final RoutingTable TABLE = new RoutingTable(List.of(
            RoutingRule.prefix("anthropic/", OPENROUTER),
            RoutingRule.anyPrefix(OPENROUTER, BackendIds.ANTHROPIC_MODEL_PREFIXES)
                    .rewritingModel(m -> BackendIds.withNamespace(ANTHROPIC, m)),
            RoutingRule.prefix("anthropic/", ANTHROPIC).rewritingModel(BackendIds::stripNamespace),
            RoutingRule.anyPrefix(ANTHROPIC, BackendIds.ANTHROPIC_MODEL_PREFIXES),
            RoutingRule.prefix("openai/", OPENROUTER),
            RoutingRule.anyPrefix(OPENROUTER, BackendIds.OPENAI_MODEL_PREFIXES)
                    .rewritingModel(m -> BackendIds.withNamespace(OPENAI, m)),
            RoutingRule.prefix("openai/", OPENAI).rewritingModel(BackendIds::stripNamespace),
            RoutingRule.anyPrefix(OPENAI, BackendIds.OPENAI_MODEL_PREFIXES),
            RoutingRule.prefix(BackendIds.HF_PREFIX, HUGGINGFACE).rewritingModel(BackendIds::stripHfPrefix),
            RoutingRule.contains("/", OPENROUTER)),
            List.of());

    private final Map<String, LlmBackend> providers;
    private final LlmBackend              defaultProvider;

    /**
     * @param defaultProvider serves unmatched models; when null the first
     *                        entry of {@code providers} does
     * @throws IllegalArgumentException when the registry is missing or there
     *                                  is no provider at all
     */
    public CloudOnlyRouter(RouterContext context,
                           Map<String, ? extends LlmBackend> providers,
                           LlmBackend defaultProvider) {
        super(context);
        if ((providers == null || providers.isEmpty()) && defaultProvider == null) {
            throw new IllegalArgumentException("at least one cloud provider is required");
        }
        LinkedHashMap<String, LlmBackend> all = new LinkedHashMap<>();
        if (providers != null) {
            all.putAll(providers);
        }
        this.defaultProvider = defaultProvider != null ? defaultProvider : all.values().iterator().next();
        all.putIfAbsent(this.defaultProvider.id(), this.defaultProvider);
        this.providers = Collections.unmodifiableMap(all);
        log.info("[CloudOnlyRouter] Providers {} default={}", this.providers.keySet(), this.defaultProvider.id());
    }

    @Override
    protected Route selectRoute(CompletionRequest request, AgentConfig agent) {
        return TABLE.resolve(request.model(), providers.keySet())
                .map(r -> new Route(providers.get(r.target()), request.withModel(r.model()), false))
                .orElseGet(() -> new Route(defaultProvider, request, false));
    }

    @Override
    public String strategy() {
        return STRATEGY;
    }

    @Override
    public List<String> backendIds() {
        List<String> ids = new ArrayList<>(providers.keySet());
        ids.remove(defaultProvider.id());
        ids.add(0, defaultProvider.id());
        return ids;
    }

    public LlmBackend defaultProvider() {
        return defaultProvider;
    }
}
