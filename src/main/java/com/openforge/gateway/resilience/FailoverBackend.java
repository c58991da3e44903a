package com.openforge.gateway.resilience;

import com.openforge.gateway.llm.AllBackendsFailedException;
import com.openforge.gateway.llm.BreakerOpenException;
import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.StreamCancelledException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Walks an ordered list of breaker-wrapped backends until one succeeds.
 *
 *   complete(request)
 *     for i, breaker in breakers:
 *       breaker rejects (OPEN)  → skip, not counted
 *       breaker.complete() ok   → return
 *       breaker.complete() fail → breaker recorded it; if i > 0 failovers++
 *     → AllBackendsFailedException(last backend failure, else last rejection)
 *
 * The failover counter counts failed attempts at non-primary positions, not
 * successful switch-overs: with [A fails, B succeeds] it stays at 0.
 *
 * Streaming moves on to the next backend only while nothing but terminal
 * error frames has been produced; once content reached the caller the
 * failure is final.  Error frames of abandoned attempts are swallowed so the
 * caller still sees exactly one terminal chunk.
 */
@Slf4j
public class FailoverBackend implements LlmBackend {

    public static final String ID = "failover";

    private final List<CircuitBreaker> breakers;
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failovers     = new AtomicLong();
    private final AtomicLong exhausted     = new AtomicLong();

    public FailoverBackend(List<CircuitBreaker> breakers) {
        this.breakers = List.copyOf(breakers);
    }

    // ── LlmBackend ───────────────────────────────────────────────────────────

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        totalRequests.incrementAndGet();
        RuntimeException lastError = null;
        int attempted = 0;
        int skipped = 0;

        for (int i = 0; i < breakers.size(); i++) {
            CircuitBreaker breaker = breakers.get(i);
            try {
                CompletionResponse response = breaker.complete(request);
                if (i > 0) {
                    log.info("[Failover] Served by {} (position {})", breaker.id(), i);
                }
                return response;
            } catch (BreakerOpenException e) {
                skipped++;
                // a real backend failure outranks any rejection
                if (attempted == 0) lastError = e;
                log.debug("[Failover] Skipping {}: breaker open", breaker.id());
            } catch (RuntimeException e) {
                attempted++;
                lastError = e;
                if (i > 0) {
                    failovers.incrementAndGet();
                }
                log.warn("[Failover] Backend {} failed ({}), trying next. Cause: {}",
                        breaker.id(), e.getClass().getSimpleName(), e.getMessage());
            }
        }

        exhausted.incrementAndGet();
        throw new AllBackendsFailedException(attempted, skipped, lastError);
    }

    @Override
    public void stream(CancellationToken token, CompletionRequest request, Consumer<CompletionChunk> emit) {
        totalRequests.incrementAndGet();
        RuntimeException lastError = null;
        int attempted = 0;
        int skipped = 0;

        for (int i = 0; i < breakers.size(); i++) {
            CircuitBreaker breaker = breakers.get(i);
            GuardedEmitter guarded = new GuardedEmitter(emit);
            try {
                breaker.stream(token, request, guarded);
                return;
            } catch (StreamCancelledException e) {
                guarded.flushHeldTerminal(request.model(), e);
                throw e;
            } catch (BreakerOpenException e) {
                skipped++;
                if (attempted == 0) lastError = e;
            } catch (RuntimeException e) {
                attempted++;
                lastError = e;
                if (i > 0) {
                    failovers.incrementAndGet();
                }
                if (guarded.contentEmitted) {
                    log.warn("[Failover] Stream from {} broke after partial output; not failing over",
                            breaker.id());
                    guarded.flushHeldTerminal(request.model(), e);
                    throw e;
                }
                log.warn("[Failover] Stream from {} failed before output ({}), trying next",
                        breaker.id(), e.getMessage());
            }
        }

        exhausted.incrementAndGet();
        AllBackendsFailedException failure = new AllBackendsFailedException(attempted, skipped, lastError);
        emit.accept(CompletionChunk.failed(request.model(), ID, failure.getMessage()));
        throw failure;
    }

    // ── Administration ───────────────────────────────────────────────────────

    /**
     * Resets the breaker of one backend.
     *
     * @return false when no backend with that id is in the list
     */
    public boolean resetBreaker(String backendId) {
        Optional<CircuitBreaker> breaker = findBreaker(backendId);
        breaker.ifPresent(CircuitBreaker::reset);
        return breaker.isPresent();
    }

    public Optional<CircuitBreaker> findBreaker(String backendId) {
        return breakers.stream().filter(b -> b.id().equals(backendId)).findFirst();
    }

    public List<BreakerStatus> breakerStatuses() {
        return breakers.stream().map(CircuitBreaker::snapshot).toList();
    }

    public FailoverStats stats() {
        return new FailoverStats(totalRequests.get(), failovers.get(), exhausted.get());
    }

    public long failoverCount() {
        return failovers.get();
    }

    public record FailoverStats(long totalRequests, long failovers, long exhausted) {}

    // ── Emitter guard ────────────────────────────────────────────────────────

    /**
     * Forwards content frames immediately and holds back terminal frames that
     * carry an error, so an attempt that is abandoned leaves no trace.
     */
    private static final class GuardedEmitter implements Consumer<CompletionChunk> {

        private final Consumer<CompletionChunk> downstream;
        private boolean contentEmitted;
        private CompletionChunk heldTerminal;

        GuardedEmitter(Consumer<CompletionChunk> downstream) {
            this.downstream = downstream;
        }

        @Override
        public void accept(CompletionChunk chunk) {
            if (chunk.done() && chunk.isError()) {
                heldTerminal = chunk;
                return;
            }
            if (!chunk.done()) {
                contentEmitted = true;
            }
            downstream.accept(chunk);
        }

        /** Delivers the held terminal frame, or synthesises one from {@code cause}. */
        void flushHeldTerminal(String model, RuntimeException cause) {
            CompletionChunk terminal = heldTerminal != null
                    ? heldTerminal
                    : CompletionChunk.failed(model, ID, cause.getMessage());
            heldTerminal = null;
            downstream.accept(terminal);
        }
    }
}
