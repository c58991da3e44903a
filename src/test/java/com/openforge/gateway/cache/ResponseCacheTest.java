package com.openforge.gateway.cache;

import com.openforge.gateway.llm.model.CompletionResponse;
import com.openforge.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {

    private static final CompletionResponse RESPONSE =
            new CompletionResponse("hello", "gpt-4o", "openai", CompletionResponse.Usage.of(10, 5));

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        cache = new ResponseCache(clock);
    }

    @Test
    void shouldReturnEntryBeforeExpiry() {
        cache.put("k", RESPONSE, Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4).plusSeconds(59));

        assertEquals(RESPONSE, cache.get("k").orElseThrow());
    }

    @Test
    void shouldMissAtAndAfterExpiry() {
        cache.put("k", RESPONSE, Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(5));

        assertTrue(cache.get("k").isEmpty());
        assertEquals(1, cache.size());
    }

    @Test
    void putShouldOverwriteExpiredEntry() {
        cache.put("k", RESPONSE, Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));
        CompletionResponse fresh = new CompletionResponse("again", "gpt-4o", "openai", null);

        cache.put("k", fresh, Duration.ofSeconds(10));

        assertEquals("again", cache.get("k").orElseThrow().content());
        assertEquals(1, cache.size());
    }

    @Test
    void shouldTrackHitRate() {
        cache.put("k", RESPONSE, Duration.ofMinutes(1));

        cache.get("k");
        cache.get("k");
        cache.get("missing");

        assertEquals(2, cache.hits());
        assertEquals(1, cache.misses());
        assertEquals(2.0 / 3.0, cache.hitRate(), 1e-9);
    }

    @Test
    void clearShouldDropEverything() {
        cache.put("a", RESPONSE, Duration.ofMinutes(1));
        cache.put("b", RESPONSE, Duration.ofMinutes(1));

        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.get("a").isEmpty());
    }
}
