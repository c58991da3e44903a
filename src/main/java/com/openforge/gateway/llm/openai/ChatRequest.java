package com.openforge.gateway.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.Message;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * OpenAI, OpenRouter, Ollama (/v1) and the HuggingFace router all accept
 * this shape, which is why one client class covers them.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens,
        Boolean stream
) {

    public static ChatRequest from(CompletionRequest request, String model, boolean stream) {
        return ChatRequest.builder()
                .model(model)
                .messages(request.messages())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .stream(stream ? Boolean.TRUE : null)
                .build();
    }
}
