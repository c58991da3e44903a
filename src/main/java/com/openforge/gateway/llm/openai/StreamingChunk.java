package com.openforge.gateway.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Represents one SSE data frame from a streaming /chat/completions response.
 *
 * Wire format (one line from the SSE stream):
 *   data: {"id":"chatcmpl-xxx","object":"chat.completion.chunk",
 *           "choices":[{"index":0,"delta":{"content":"Hello"},"finish_reason":null}]}
 *
 * Last frame:
 *   data: [DONE]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String model,
        List<ChunkChoice> choices
) {

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    /** Sparse delta; the first frame usually carries only the role. */
    public record DeltaMessage(
            String role,
            String content
    ) {}
}
