package com.openforge.gateway.llm;

/** Routing could not find any registered backend for the request. */
public class NoBackendAvailableException extends LlmException {

    public NoBackendAvailableException(String message) {
        super(message);
    }
}
