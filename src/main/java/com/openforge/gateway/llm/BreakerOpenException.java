package com.openforge.gateway.llm;

import lombok.Getter;

/**
 * Raised by a circuit breaker that rejected a call.  The wrapped backend was
 * never contacted, so this is not counted as a backend failure.
 */
@Getter
public class BreakerOpenException extends LlmException {

    private final String backendId;

    public BreakerOpenException(String backendId) {
        super("Circuit breaker open for backend [%s]".formatted(backendId));
        this.backendId = backendId;
    }
}
