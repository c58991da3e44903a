package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.agent.ModelTier;
import com.openforge.gateway.agent.PropertiesAgentRegistry;
import com.openforge.gateway.llm.NoBackendAvailableException;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;
import com.openforge.gateway.llm.model.Message;
import com.openforge.gateway.support.FakeBackend;
import com.openforge.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TierRouterTest {

    private PropertiesAgentRegistry registry;
    private FakeBackend ollama;
    private Map<String, FakeBackend> cloud;

    @BeforeEach
    void setUp() {
        registry = new PropertiesAgentRegistry(Map.of(), MutableClock.at("2025-03-10T12:00:00Z"));
        registry.register(agent("local-agent", ModelTier.LOCAL, "llama3.2"));
        registry.register(agent("cloud-agent", ModelTier.CLOUD, null));
        registry.register(agent("hybrid-agent", ModelTier.HYBRID, null));
        ollama = new FakeBackend("ollama");
        cloud = new LinkedHashMap<>();
        for (String id : List.of("openrouter", "anthropic", "openai", "huggingface")) {
            cloud.put(id, new FakeBackend(id));
        }
    }

    @Test
    void localTierShouldAlwaysUseLocalBackend() {
        CompletionResponse response = router(ollama, cloud).complete(complexRequest("local-agent"));

        assertEquals("ollama", response.provider());
        assertEquals("llama3.2", ollama.lastRequest().model());
    }

    @Test
    void localTierWithoutLocalBackendShouldFail() {
        TierRouter router = router(null, cloud);

        NoBackendAvailableException failure = assertThrows(NoBackendAvailableException.class,
                () -> router.complete(simpleRequest("local-agent", null)));
        assertTrue(failure.getMessage().contains("local-agent"));
    }

    @Test
    void cloudTierShouldSelectByModelPrefix() {
        TierRouter router = router(ollama, cloud);

        assertEquals("anthropic", router.complete(simpleRequest("cloud-agent", "claude-3-haiku")).provider());
        assertEquals("anthropic", router.complete(simpleRequest("cloud-agent", "anthropic/claude-3-haiku")).provider());
        assertEquals("claude-3-haiku", cloud.get("anthropic").lastRequest().model());
        assertEquals("openai", router.complete(simpleRequest("cloud-agent", "gpt-4o")).provider());
        assertEquals("huggingface", router.complete(simpleRequest("cloud-agent", "hf:bigscience/bloom")).provider());
        assertEquals("openrouter", router.complete(simpleRequest("cloud-agent", "meta-llama/llama-3-70b")).provider());
        assertEquals(0, ollama.calls());
    }

    @Test
    void cloudTierFallbackShouldFollowPriority() {
        TierRouter router = router(ollama, cloud);
        assertEquals("anthropic", router.complete(simpleRequest("cloud-agent", "mystery")).provider());

        Map<String, FakeBackend> onlyAggregator = Map.of("openrouter", new FakeBackend("openrouter"));
        assertEquals("openrouter", router(ollama, onlyAggregator)
                .complete(simpleRequest("cloud-agent", "gpt-4o")).provider());
    }

    @Test
    void cloudTierShouldNotForwardLocalModelNames() {
        router(ollama, cloud).complete(simpleRequest("cloud-agent", "llama3"));

        assertNull(cloud.get("anthropic").lastRequest().model());
    }

    @Test
    void hybridSimpleRequestShouldStayLocal() {
        TierRouter router = router(ollama, cloud);

        assertEquals("ollama", router.complete(simpleRequest("hybrid-agent", null)).provider());
        assertEquals(1, router.metrics().localHits());
    }

    @Test
    void hybridComplexRequestShouldGoToCloud() {
        TierRouter router = router(ollama, cloud);

        CompletionResponse response = router.complete(complexRequest("hybrid-agent"));

        assertEquals("anthropic", response.provider());
        assertEquals(1, router.metrics().cloudHits());
    }

    @Test
    void hybridThresholdShouldBeInclusive() {
        // chars > 8000 (+0.3) and "analyze" in the system prompt (+0.2) = exactly 0.5
        List<Message> messages = List.of(Message.system("analyze"), Message.user("q".repeat(8001)));

        CompletionResponse response = router(ollama, cloud)
                .complete(CompletionRequest.of("hybrid-agent", null, messages));

        assertEquals("anthropic", response.provider());
    }

    @Test
    void hybridShouldCrossOverWhenPreferredSideIsMissing() {
        assertEquals("anthropic", router(null, cloud).complete(simpleRequest("hybrid-agent", null)).provider());
        assertEquals("ollama", router(ollama, Map.of()).complete(complexRequest("hybrid-agent")).provider());
    }

    @Test
    void localRouteShouldDropCloudModelName() {
        router(ollama, cloud).complete(simpleRequest("hybrid-agent", "anthropic/claude-3-haiku"));

        assertNull(ollama.lastRequest().model());
    }

    @Test
    void unknownAgentShouldBeTreatedAsHybrid() {
        assertEquals("ollama", router(ollama, cloud).complete(simpleRequest("nobody", null)).provider());
    }

    @Test
    void noBackendsAtAllShouldFail() {
        TierRouter router = router(null, Map.of());

        assertThrows(NoBackendAvailableException.class, () -> router.complete(simpleRequest("hybrid-agent", null)));
    }

    private TierRouter router(FakeBackend local, Map<String, FakeBackend> cloudBackends) {
        RouterContext context = RouterContext.builder().registry(registry).build();
        return new TierRouter(context, local, cloudBackends);
    }

    private static AgentConfig agent(String id, ModelTier tier, String defaultModel) {
        return AgentConfig.builder()
                .id(id).name(id).tier(tier).defaultModel(defaultModel)
                .complexityThreshold(0.5).build();
    }

    private static CompletionRequest simpleRequest(String agentId, String model) {
        return CompletionRequest.of(agentId, model, List.of(Message.user("hi")));
    }

    private static CompletionRequest complexRequest(String agentId) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("Evaluate each option and compare them step by step."));
        for (int i = 0; i < 12; i++) {
            messages.add(Message.user("p".repeat(700)));
        }
        return CompletionRequest.of(agentId, null, messages);
    }
}
