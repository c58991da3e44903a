package com.openforge.gateway.llm;

import lombok.Getter;

/** A named backend failed; the original failure is the cause. */
@Getter
public class BackendException extends LlmException {

    private final String backendId;

    public BackendException(String backendId, Throwable cause) {
        super("Backend [%s] failed: %s".formatted(backendId, cause.getMessage()), cause);
        this.backendId = backendId;
    }
}
