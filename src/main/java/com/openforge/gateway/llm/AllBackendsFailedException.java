package com.openforge.gateway.llm;

import lombok.Getter;

/**
 * The failover orchestrator walked its whole list without a success.
 * The cause is the last failure observed (or the last breaker rejection when
 * every backend was skipped).
 */
@Getter
public class AllBackendsFailedException extends LlmException {

    private final int attempted;
    private final int skipped;

    public AllBackendsFailedException(int attempted, int skipped, Throwable lastError) {
        super("All backends failed (attempted=%d, skipped=%d): %s".formatted(
                attempted, skipped, lastError == null ? "no backends configured" : lastError.getMessage()),
                lastError);
        this.attempted = attempted;
        this.skipped = skipped;
    }
}
