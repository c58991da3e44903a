package com.openforge.gateway.llm.model;

/**
 * Result of a non-streaming completion.
 *
 * {@code provider} is the id of the backend that actually produced the text,
 * which after failover or aggregator redirects may differ from the backend
 * the caller had in mind.
 */
public record CompletionResponse(
        String content,
        String model,
        String provider,
        Usage usage
) {

    public CompletionResponse {
        usage = usage == null ? Usage.EMPTY : usage;
    }

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {

        public static final Usage EMPTY = new Usage(0, 0, 0);

        public static Usage of(int promptTokens, int completionTokens) {
            return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
        }
    }
}
