package com.openforge.gateway.resilience;

import com.openforge.gateway.llm.BreakerOpenException;
import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.StreamCancelledException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Per-backend circuit breaker that is itself an {@link LlmBackend}.
 *
 * Call graph (complete and stream):
 *
 *   complete(request)
 *     └─ allowRequest()            lock held only for the state check
 *           ↓ rejected → BreakerOpenException, delegate never called
 *     └─ delegate.complete(request) no lock held during the network call
 *     └─ recordResult(error|null)  lock re-acquired to update counters
 *
 * Counting rules:
 *   - every failure bumps the failure count, stamps lastFailure and clears
 *     the success streak; reaching the threshold opens the circuit from any
 *     state, so one failed half-open probe re-opens it immediately
 *   - successes only lengthen the streak; two in a row while HALF_OPEN close
 *     the circuit and clear the failure count
 *   - a cancelled stream is the caller's doing and is not recorded
 */
@Slf4j
public class CircuitBreaker implements LlmBackend {

    public static final int      DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_RESET_TIMEOUT     = Duration.ofSeconds(60);

    static final int HALF_OPEN_SUCCESSES_TO_CLOSE = 2;

    private final LlmBackend delegate;
    private final int        failureThreshold;
    private final Duration   resetTimeout;
    private final Clock      clock;

    private final ReentrantLock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private int     failureCount;
    private int     successCount;
    private Instant lastFailure;

    public CircuitBreaker(LlmBackend delegate, int failureThreshold, Duration resetTimeout, Clock clock) {
        this.delegate         = delegate;
        this.failureThreshold = failureThreshold > 0 ? failureThreshold : DEFAULT_FAILURE_THRESHOLD;
        this.resetTimeout     = resetTimeout != null && !resetTimeout.isZero() && !resetTimeout.isNegative()
                ? resetTimeout : DEFAULT_RESET_TIMEOUT;
        this.clock            = clock;
    }

    public CircuitBreaker(LlmBackend delegate) {
        this(delegate, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT, Clock.systemUTC());
    }

    // ── State machine ────────────────────────────────────────────────────────

    /**
     * Decides whether a call may go through.  In OPEN this is also the only
     * place that moves the breaker to HALF_OPEN.
     */
    public boolean allowRequest() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                case HALF_OPEN:
                    return true;
                case OPEN:
                default:
                    Duration sinceFailure = Duration.between(lastFailure, clock.instant());
                    if (sinceFailure.compareTo(resetTimeout) > 0) {
                        transitionTo(CircuitState.HALF_OPEN);
                        successCount = 0;
                        return true;
                    }
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Records the outcome of one call; {@code error == null} means success. */
    public void recordResult(Throwable error) {
        lock.lock();
        try {
            if (error != null) {
                failureCount++;
                lastFailure = clock.instant();
                successCount = 0;
                if (failureCount >= failureThreshold && state != CircuitState.OPEN) {
                    log.warn("[CircuitBreaker:{}] Opening after {} failures. Last error: {}",
                            id(), failureCount, error.getMessage());
                    transitionTo(CircuitState.OPEN);
                }
                return;
            }
            successCount++;
            if (state == CircuitState.HALF_OPEN && successCount >= HALF_OPEN_SUCCESSES_TO_CLOSE) {
                transitionTo(CircuitState.CLOSED);
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Administrative override: back to CLOSED with every counter cleared. */
    public void reset() {
        lock.lock();
        try {
            log.info("[CircuitBreaker:{}] Manual reset from {}", id(), state.label());
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailure = null;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public BreakerStatus snapshot() {
        lock.lock();
        try {
            return new BreakerStatus(id(), state, failureCount, successCount, lastFailure,
                    failureThreshold, resetTimeout.toMillis());
        } finally {
            lock.unlock();
        }
    }

    public LlmBackend delegate() {
        return delegate;
    }

    // ── LlmBackend ───────────────────────────────────────────────────────────

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        if (!allowRequest()) {
            throw new BreakerOpenException(id());
        }
        CompletionResponse response;
        try {
            response = delegate.complete(request);
        } catch (RuntimeException e) {
            recordResult(e);
            throw e;
        }
        recordResult(null);
        return response;
    }

    @Override
    public void stream(CancellationToken token, CompletionRequest request, Consumer<CompletionChunk> emit) {
        if (!allowRequest()) {
            BreakerOpenException rejected = new BreakerOpenException(id());
            emit.accept(CompletionChunk.failed(request.model(), id(), rejected.getMessage()));
            throw rejected;
        }
        try {
            delegate.stream(token, request, emit);
        } catch (StreamCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            recordResult(e);
            throw e;
        }
        recordResult(null);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Caller holds the lock. */
    private void transitionTo(CircuitState next) {
        if (state != next) {
            log.info("[CircuitBreaker:{}] {} → {}", id(), state.label(), next.label());
            state = next;
        }
    }
}
