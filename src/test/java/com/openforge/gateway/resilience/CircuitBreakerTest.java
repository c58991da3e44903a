package com.openforge.gateway.resilience;

import com.openforge.gateway.llm.BreakerOpenException;
import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmException;
import com.openforge.gateway.llm.StreamCancelledException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.Message;
import com.openforge.gateway.support.FakeBackend;
import com.openforge.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private static final CompletionRequest REQUEST =
            CompletionRequest.of("agent", "gpt-4o", List.of(Message.user("hi")));

    private MutableClock clock;
    private FakeBackend backend;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        backend = new FakeBackend("openai");
        breaker = new CircuitBreaker(backend, 3, Duration.ofSeconds(60), clock);
    }

    @Test
    void shouldStayClosedBelowThreshold() {
        backend.failAlways();
        failTimes(2);

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(2, breaker.snapshot().failureCount());
    }

    @Test
    void shouldOpenAfterThresholdAndRejectWithoutCallingBackend() {
        backend.failAlways();
        failTimes(3);
        assertEquals(CircuitState.OPEN, breaker.state());

        int callsBefore = backend.calls();
        BreakerOpenException rejected = assertThrows(BreakerOpenException.class, () -> breaker.complete(REQUEST));

        assertEquals("openai", rejected.getBackendId());
        assertEquals(callsBefore, backend.calls());
    }

    @Test
    void shouldMoveToHalfOpenOnlyAfterResetTimeout() {
        backend.failAlways();
        failTimes(3);

        clock.advance(Duration.ofSeconds(60));
        assertFalse(breaker.allowRequest());
        assertEquals(CircuitState.OPEN, breaker.state());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(breaker.allowRequest());
        assertEquals(CircuitState.HALF_OPEN, breaker.state());
    }

    @Test
    void shouldCloseAfterTwoHalfOpenSuccesses() {
        backend.failAlways();
        failTimes(3);
        clock.advance(Duration.ofSeconds(61));
        backend.succeed();

        breaker.complete(REQUEST);
        assertEquals(CircuitState.HALF_OPEN, breaker.state());

        breaker.complete(REQUEST);
        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(0, breaker.snapshot().failureCount());
    }

    @Test
    void shouldReopenWhenHalfOpenProbeFails() {
        backend.failAlways();
        failTimes(3);
        clock.advance(Duration.ofSeconds(61));

        assertThrows(LlmException.class, () -> breaker.complete(REQUEST));

        assertEquals(CircuitState.OPEN, breaker.state());
        assertThrows(BreakerOpenException.class, () -> breaker.complete(REQUEST));
    }

    @Test
    void shouldNotCloseOnSingleHalfOpenSuccessFollowedByFailure() {
        backend.failAlways();
        failTimes(3);
        clock.advance(Duration.ofSeconds(61));

        backend.succeed();
        breaker.complete(REQUEST);
        backend.failAlways();
        assertThrows(LlmException.class, () -> breaker.complete(REQUEST));

        assertEquals(CircuitState.OPEN, breaker.state());
        assertEquals(0, breaker.snapshot().successCount());
    }

    @Test
    void successesInClosedStateDoNotClearFailureCount() {
        backend.failFirst(2);
        failTimes(2);
        breaker.complete(REQUEST);
        breaker.complete(REQUEST);

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(2, breaker.snapshot().failureCount());

        backend.failAlways();
        failTimes(1);
        assertEquals(CircuitState.OPEN, breaker.state());
    }

    @Test
    void resetShouldCloseAndClearCounters() {
        backend.failAlways();
        failTimes(3);

        breaker.reset();

        BreakerStatus status = breaker.snapshot();
        assertEquals(CircuitState.CLOSED, status.state());
        assertEquals(0, status.failureCount());
        assertNull(status.lastFailure());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void shouldFallBackToDefaultsForNonPositiveSettings() {
        CircuitBreaker defaults = new CircuitBreaker(backend, 0, Duration.ZERO, clock);

        BreakerStatus status = defaults.snapshot();
        assertEquals(CircuitBreaker.DEFAULT_FAILURE_THRESHOLD, status.failureThreshold());
        assertEquals(60_000L, status.resetTimeoutMs());
    }

    @Test
    void openBreakerShouldEmitTerminalChunkWhenStreaming() {
        backend.failAlways();
        failTimes(3);
        List<CompletionChunk> chunks = new ArrayList<>();

        assertThrows(BreakerOpenException.class,
                () -> breaker.stream(CancellationToken.none(), REQUEST, chunks::add));

        assertEquals(1, chunks.size());
        assertTrue(chunks.get(0).done());
        assertTrue(chunks.get(0).isError());
    }

    @Test
    void cancelledStreamShouldNotCountAsFailure() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(StreamCancelledException.class, () -> breaker.stream(token, REQUEST, chunk -> {}));

        assertEquals(0, breaker.snapshot().failureCount());
        assertEquals(CircuitState.CLOSED, breaker.state());
    }

    private void failTimes(int n) {
        for (int i = 0; i < n; i++) {
            assertThrows(LlmException.class, () -> breaker.complete(REQUEST));
        }
    }
}
