package com.openforge.gateway.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A completion request as it enters the routing layer.
 *
 * Only {@code agentId} and {@code messages} are mandatory; model, temperature
 * and maxTokens are filled from the agent's configuration by the router when
 * the caller leaves them unset.  Records are immutable, so routers derive a
 * copy via {@link #withDefaults} instead of mutating the caller's instance.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionRequest(
        String agentId,
        List<Message> messages,
        String model,
        Double temperature,
        Integer maxTokens
) {

    public CompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static CompletionRequest of(String agentId, String model, List<Message> messages) {
        return CompletionRequest.builder()
                .agentId(agentId)
                .model(model)
                .messages(messages)
                .build();
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    /**
     * Returns a copy where every unset field takes the supplied default.
     * Fields the caller set explicitly are never overridden; a default of
     * null, blank or non-positive is treated as "no default".
     */
    public CompletionRequest withDefaults(String defaultModel, Integer defaultMaxTokens, Double defaultTemperature) {
        CompletionRequestBuilder copy = toBuilder();
        if (!hasModel() && defaultModel != null && !defaultModel.isBlank()) {
            copy.model(defaultModel);
        }
        if (maxTokens == null && defaultMaxTokens != null && defaultMaxTokens > 0) {
            copy.maxTokens(defaultMaxTokens);
        }
        if (temperature == null && defaultTemperature != null && defaultTemperature > 0) {
            copy.temperature(defaultTemperature);
        }
        return copy.build();
    }

    /** Same request pointed at another model; everything else is kept. */
    public CompletionRequest withModel(String newModel) {
        return toBuilder().model(newModel).build();
    }
}
