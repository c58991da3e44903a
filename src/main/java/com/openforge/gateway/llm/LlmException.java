package com.openforge.gateway.llm;

/**
 * Root of the gateway's unchecked exception taxonomy.
 *
 * Subtypes:
 *   BreakerOpenException          request rejected without contacting the backend
 *   NoBackendAvailableException   routing found no eligible backend
 *   BackendException              a specific backend failed (id + cause)
 *   AllBackendsFailedException    failover list exhausted
 *   LlmRateLimitException         upstream answered 429
 *   StreamCancelledException      caller aborted a stream
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
