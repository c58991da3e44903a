package com.openforge.gateway.llm.openai;

import com.openforge.gateway.llm.LlmException;
import com.openforge.gateway.llm.model.Message;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Text of the first choice, or empty when the provider sent no content. */
    public String firstContent() {
        if (choices == null || choices.isEmpty()) {
            throw new LlmException("LLM returned no choices in response: " + id);
        }
        Message message = choices.get(0).message();
        return message == null || message.content() == null ? "" : message.content();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
