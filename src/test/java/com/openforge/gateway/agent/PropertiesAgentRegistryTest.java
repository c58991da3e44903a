package com.openforge.gateway.agent;

import com.openforge.gateway.config.GatewayProperties;
import com.openforge.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesAgentRegistryTest {

    private MutableClock clock;
    private PropertiesAgentRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        registry = new PropertiesAgentRegistry(Map.of(
                "summarizer", new GatewayProperties.AgentProperties(
                        "Summarizer", ModelTier.LOCAL, "llama3.2", 256, 0.1, 0.5, 0, 2),
                "reviewer", new GatewayProperties.AgentProperties(
                        null, null, "gpt-4o", 0, 0, 0.7, 1500, 0)),
                clock);
    }

    @Test
    void shouldExposeConfiguredAgents() {
        AgentConfig summarizer = registry.get("summarizer");

        assertEquals("Summarizer", summarizer.name());
        assertEquals(ModelTier.LOCAL, summarizer.tier());
        assertEquals("llama3.2", summarizer.defaultModel());
        assertEquals(256, summarizer.maxTokens());
        assertEquals(List.of("reviewer", "summarizer"), registry.list());
    }

    @Test
    void missingNameAndTierShouldFallBack() {
        AgentConfig reviewer = registry.get("reviewer");

        assertEquals("reviewer", reviewer.name());
        assertEquals(ModelTier.HYBRID, reviewer.tier());
        assertEquals(0.7, reviewer.complexityThreshold(), 1e-9);
    }

    @Test
    void unknownAgentShouldGetDefaults() {
        AgentConfig unknown = registry.get("ghost");

        assertEquals("ghost", unknown.id());
        assertEquals(ModelTier.HYBRID, unknown.tier());
        assertEquals(AgentConfig.DEFAULT_COMPLEXITY_THRESHOLD, unknown.complexityThreshold(), 1e-9);
        assertTrue(registry.allow("ghost"));
    }

    @Test
    void limiterShouldResetEveryMinute() {
        assertTrue(registry.allow("summarizer"));
        assertTrue(registry.allow("summarizer"));
        assertFalse(registry.allow("summarizer"));

        clock.advance(Duration.ofMinutes(1));
        assertTrue(registry.allow("summarizer"));
    }

    @Test
    void zeroLimitMeansUnlimited() {
        for (int i = 0; i < 1000; i++) {
            assertTrue(registry.allow("reviewer"));
        }
    }
}
