package com.openforge.gateway.llm;

/** Upstream provider answered HTTP 429. */
public class LlmRateLimitException extends LlmException {

    public LlmRateLimitException(String message) {
        super(message);
    }
}
