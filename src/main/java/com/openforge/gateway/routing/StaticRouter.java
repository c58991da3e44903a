package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.NoBackendAvailableException;
import com.openforge.gateway.llm.model.CompletionRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.openforge.gateway.routing.BackendIds.ANTHROPIC;
import static com.openforge.gateway.routing.BackendIds.HUGGINGFACE;
import static com.openforge.gateway.routing.BackendIds.OLLAMA;
import static com.openforge.gateway.routing.BackendIds.OPENAI;
import static com.openforge.gateway.routing.BackendIds.OPENROUTER;

/**
 * Routes purely on the model name through a fixed rule table.
 *
 *   llama* mistral* qwen* phi*
 *   gemma* codellama* deepseek-coder* → ollama
 *   openai/*                       → openai     (namespace stripped)
 *   anthropic/*                    → anthropic  (namespace stripped)
 *   gpt-* o1-*                     → openai     (deprecated, use openrouter)
 *   claude-*                       → anthropic  (deprecated, use openrouter)
 *   hf:*                           → huggingface (prefix stripped)
 *   anything with a '/'            → openrouter
 *   no match → first registered of ollama, openrouter, anthropic, openai, huggingface
 *
 * Agent tier is ignored.
 */
@Slf4j
public class StaticRouter extends AbstractRouter {

    public static final String STRATEGY = "static";

    static final RoutingTable TABLE = new RoutingTable(rules(),
            List.of(OLLAMA, OPENROUTER, ANTHROPIC, OPENAI, HUGGINGFACE));

    private final Map<String, LlmBackend> backends;

    public StaticRouter(RouterContext context, Map<String, ? extends LlmBackend> backends) {
        super(context);
        this.backends = Collections.unmodifiableMap(new LinkedHashMap<>(backends));
    }

    @Override
    protected Route selectRoute(CompletionRequest request, AgentConfig agent) {
        Set<String> available = backends.keySet();
        RoutingTable.Resolution resolution = TABLE.resolve(request.model(), available)
                .orElseThrow(() -> new NoBackendAvailableException(
                        "no backend registered for model '%s'".formatted(request.model())));

        if (resolution.rule() != null && resolution.rule().deprecated()) {
            log.warn("[StaticRouter] Model '{}' matched legacy rule {}; route it through {} instead",
                    request.model(), resolution.rule(), resolution.rule().replacement());
        }
        String target = resolution.target();
        return new Route(backends.get(target), request.withModel(resolution.model()), OLLAMA.equals(target));
    }

    @Override
    public String strategy() {
        return STRATEGY;
    }

    @Override
    public List<String> backendIds() {
        List<String> ordered = new ArrayList<>();
        TABLE.fallbackOrder().stream().filter(backends::containsKey).forEach(ordered::add);
        backends.keySet().stream().filter(id -> !ordered.contains(id)).forEach(ordered::add);
        return ordered;
    }

    private static List<RoutingRule> rules() {
        List<RoutingRule> rules = new ArrayList<>();
        for (String family : BackendIds.LOCAL_MODEL_PREFIXES) {
            rules.add(RoutingRule.prefix(family, OLLAMA));
        }
        // vendor APIs take bare model names
        rules.add(RoutingRule.prefix("openai/", OPENAI).rewritingModel(BackendIds::stripNamespace));
        rules.add(RoutingRule.prefix("anthropic/", ANTHROPIC).rewritingModel(BackendIds::stripNamespace));
        rules.add(RoutingRule.anyPrefix(OPENAI, BackendIds.OPENAI_MODEL_PREFIXES)
                .deprecatedInFavourOf(OPENROUTER));
        rules.add(RoutingRule.anyPrefix(ANTHROPIC, BackendIds.ANTHROPIC_MODEL_PREFIXES)
                .deprecatedInFavourOf(OPENROUTER));
        rules.add(RoutingRule.prefix(BackendIds.HF_PREFIX, HUGGINGFACE).rewritingModel(BackendIds::stripHfPrefix));
        rules.add(RoutingRule.contains("/", OPENROUTER));
        return rules;
    }
}
