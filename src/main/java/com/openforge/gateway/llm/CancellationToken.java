package com.openforge.gateway.llm;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag handed to {@link LlmBackend#stream}.
 *
 * The HTTP layer cancels it when the client goes away; backends poll it
 * between chunks and stop with a {@link StreamCancelledException}.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A fresh token that only its holder can cancel. */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /** Shared token for callers that have no way to cancel. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new StreamCancelledException();
        }
    }
}
