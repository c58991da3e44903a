package com.openforge.gateway.web.dto;

import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.Message;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Request body for POST /v1/chat and POST /v1/chat/stream.
 *
 * @param agentId   calling agent; selects per-agent defaults and limits
 * @param model     optional; the agent's default model applies when absent
 */
public record ChatRequestBody(

        @NotBlank(message = "agent_id must not be blank")
        String agentId,

        @NotEmpty(message = "messages must not be empty")
        List<@Valid MessageBody> messages,

        String model,

        @PositiveOrZero(message = "temperature must not be negative")
        Double temperature,

        @Positive(message = "max_tokens must be positive")
        Integer maxTokens
) {

    public record MessageBody(
            @NotBlank(message = "role must not be blank")
            String role,
            String content
    ) {}

    public CompletionRequest toCompletionRequest() {
        return CompletionRequest.builder()
                .agentId(agentId)
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .messages(messages.stream().map(m -> new Message(m.role(), m.content())).toList())
                .build();
    }
}
