package com.openforge.gateway.support;

import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.LlmException;
import com.openforge.gateway.llm.StreamCancelledException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable in-memory backend.
 *
 * Replies "[id] last message" with 100 prompt / 50 completion tokens.  The
 * first {@code failures} calls fail; {@link #failAlways()} makes every call
 * fail.  Streams emit the reply in two content chunks and a done chunk, or,
 * with {@link #failMidStream()}, one content chunk followed by an error.
 */
public final class FakeBackend implements LlmBackend {

    private final String id;
    private final String defaultModel;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<CompletionRequest> requests = new CopyOnWriteArrayList<>();

    private volatile int failures;
    private volatile boolean failAlways;
    private volatile boolean failMidStream;

    public FakeBackend(String id) {
        this(id, id + "-default");
    }

    public FakeBackend(String id, String defaultModel) {
        this.id = id;
        this.defaultModel = defaultModel;
    }

    public FakeBackend failFirst(int n) {
        this.failures = n;
        return this;
    }

    public FakeBackend failAlways() {
        this.failAlways = true;
        return this;
    }

    public FakeBackend succeed() {
        this.failAlways = false;
        this.failures = 0;
        return this;
    }

    public FakeBackend failMidStream() {
        this.failMidStream = true;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public CompletionRequest lastRequest() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        int call = calls.incrementAndGet();
        requests.add(request);
        if (shouldFail(call)) {
            throw new LlmException("simulated failure of " + id + " on call " + call);
        }
        return new CompletionResponse(reply(request), modelOf(request), id, CompletionResponse.Usage.of(100, 50));
    }

    @Override
    public void stream(CancellationToken token, CompletionRequest request, Consumer<CompletionChunk> emit) {
        int call = calls.incrementAndGet();
        requests.add(request);
        String model = modelOf(request);
        if (shouldFail(call)) {
            LlmException failure = new LlmException("simulated stream failure of " + id);
            emit.accept(CompletionChunk.failed(model, id, failure.getMessage()));
            throw failure;
        }
        emit.accept(CompletionChunk.content("[" + id + "] ", model, id));
        if (failMidStream) {
            LlmException failure = new LlmException("connection reset by " + id);
            emit.accept(CompletionChunk.failed(model, id, failure.getMessage()));
            throw failure;
        }
        if (token.isCancelled()) {
            StreamCancelledException cancelled = new StreamCancelledException();
            emit.accept(CompletionChunk.failed(model, id, cancelled.getMessage()));
            throw cancelled;
        }
        emit.accept(CompletionChunk.content(lastMessage(request), model, id));
        emit.accept(CompletionChunk.done(model, id));
    }

    private boolean shouldFail(int call) {
        return failAlways || call <= failures;
    }

    private String modelOf(CompletionRequest request) {
        return request.hasModel() ? request.model() : defaultModel;
    }

    private String reply(CompletionRequest request) {
        return "[" + id + "] " + lastMessage(request);
    }

    private static String lastMessage(CompletionRequest request) {
        return request.messages().isEmpty() ? "" : request.messages().get(request.messages().size() - 1).content();
    }
}
