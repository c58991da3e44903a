package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.agent.ModelTier;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.NoBackendAvailableException;
import com.openforge.gateway.llm.model.CompletionRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.openforge.gateway.routing.BackendIds.ANTHROPIC;
import static com.openforge.gateway.routing.BackendIds.HUGGINGFACE;
import static com.openforge.gateway.routing.BackendIds.OPENAI;
import static com.openforge.gateway.routing.BackendIds.OPENROUTER;

/**
 * Routes on the calling agent's tier.
 *
 *   LOCAL   → local backend
 *   CLOUD   → cloud backend picked by model prefix
 *   HYBRID  → ComplexityScorer.score(request) >= agent threshold ? cloud : local
 *
 * Cloud selection: anthropic/ claude- → anthropic, openai/ gpt- o1- → openai,
 * hf: → huggingface, any other name with a '/' → openrouter; otherwise the
 * first registered of anthropic, openai, openrouter, huggingface, then any
 * other registered cloud backend.
 *
 * A hybrid request whose preferred side has no backend goes to the other
 * side.  LOCAL and CLOUD agents never cross over.
 *
 * Model names are only forwarded to a backend that can serve them: a local
 * family name sent to a cloud backend (or a cloud name sent to the local
 * backend) is dropped so the backend's own default model applies.
 */
@Slf4j
public class TierRouter extends AbstractRouter {

    public static final String STRATEGY = "tier";

    static final RoutingTable CLOUD_TABLE = new RoutingTable(List.of(
            RoutingRule.prefix("anthropic/", ANTHROPIC).rewritingModel(BackendIds::stripNamespace),
            RoutingRule.anyPrefix(ANTHROPIC, BackendIds.ANTHROPIC_MODEL_PREFIXES),
            RoutingRule.prefix("openai/", OPENAI).rewritingModel(BackendIds::stripNamespace),
            RoutingRule.anyPrefix(OPENAI, BackendIds.OPENAI_MODEL_PREFIXES),
            RoutingRule.prefix(BackendIds.HF_PREFIX, HUGGINGFACE).rewritingModel(BackendIds::stripHfPrefix),
            RoutingRule.contains("/", OPENROUTER)),
            List.of(ANTHROPIC, OPENAI, OPENROUTER, HUGGINGFACE));

    private final LlmBackend              localBackend;
    private final Map<String, LlmBackend> cloudBackends;

    /**
     * @param localBackend  may be null when no local runtime is configured
     * @param cloudBackends keyed by backend id; iteration order is the last-resort fallback order
     */
    public TierRouter(RouterContext context, LlmBackend localBackend, Map<String, ? extends LlmBackend> cloudBackends) {
        super(context);
        this.localBackend  = localBackend;
        this.cloudBackends = Collections.unmodifiableMap(new LinkedHashMap<>(cloudBackends));
    }

    @Override
    protected Route selectRoute(CompletionRequest request, AgentConfig agent) {
        ModelTier tier = agent.tier() != null ? agent.tier() : ModelTier.HYBRID;
        switch (tier) {
            case LOCAL:
                return routeLocal(request).orElseThrow(() -> new NoBackendAvailableException(
                        "agent '%s' is local-tier but no local backend is registered".formatted(agent.id())));
            case CLOUD:
                return routeCloud(request).orElseThrow(() -> new NoBackendAvailableException(
                        "agent '%s' is cloud-tier but no cloud backend is registered".formatted(agent.id())));
            case HYBRID:
            default:
                double score = ComplexityScorer.score(request);
                boolean wantsCloud = score >= agent.complexityThreshold();
                log.debug("[TierRouter] agent={} complexity={} threshold={} → {}",
                        agent.id(), "%.2f".formatted(score), agent.complexityThreshold(),
                        wantsCloud ? "cloud" : "local");
                Optional<Route> preferred = wantsCloud ? routeCloud(request) : routeLocal(request);
                return preferred
                        .or(() -> wantsCloud ? routeLocal(request) : routeCloud(request))
                        .orElseThrow(() -> new NoBackendAvailableException("no backend registered"));
        }
    }

    @Override
    public String strategy() {
        return STRATEGY;
    }

    @Override
    public List<String> backendIds() {
        List<String> ids = new ArrayList<>();
        if (localBackend != null) {
            ids.add(localBackend.id());
        }
        ids.addAll(cloudBackends.keySet());
        return ids;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<Route> routeLocal(CompletionRequest request) {
        if (localBackend == null) {
            return Optional.empty();
        }
        CompletionRequest routed = request.hasModel() && !BackendIds.isLocalModel(request.model())
                ? request.withModel(null)
                : request;
        return Optional.of(new Route(localBackend, routed, true));
    }

    private Optional<Route> routeCloud(CompletionRequest request) {
        if (cloudBackends.isEmpty()) {
            return Optional.empty();
        }
        String model = BackendIds.isLocalModel(request.model()) ? null : request.model();
        return CLOUD_TABLE.resolve(model, cloudBackends.keySet())
                .map(r -> new Route(cloudBackends.get(r.target()), request.withModel(r.model()), false))
                .or(() -> {
                    Map.Entry<String, LlmBackend> first = cloudBackends.entrySet().iterator().next();
                    return Optional.of(new Route(first.getValue(), request.withModel(model), false));
                });
    }
}
