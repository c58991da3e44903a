package com.openforge.gateway.llm;

import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;

import java.util.function.Consumer;

/**
 * The capability every upstream model integration offers to the router.
 *
 * Routers, breakers and the failover orchestrator all implement this same
 * interface, so they compose freely: a router can route to a breaker which
 * wraps a vendor client, and the orchestrator walks a list of breakers.
 *
 * Contract for {@link #stream}:
 *   - emits zero or more content chunks, then exactly one chunk with done=true
 *   - the terminal chunk is emitted on the error path too (with error set)
 *     before the exception is thrown
 *   - the cancellation token is checked between chunks
 */
public interface LlmBackend {

    /** Stable identifier, e.g. "openai", "ollama", "openrouter". */
    String id();

    /** Blocking completion.  Failures surface as {@link LlmException}s. */
    CompletionResponse complete(CompletionRequest request);

    /** Streaming completion; chunks are pushed to {@code emit} on the calling thread. */
    void stream(CancellationToken token, CompletionRequest request, Consumer<CompletionChunk> emit);
}
