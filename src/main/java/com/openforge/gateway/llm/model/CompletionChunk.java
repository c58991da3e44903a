package com.openforge.gateway.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One frame of a streamed completion.
 *
 * A stream is a finite sequence of content frames followed by exactly one
 * frame with {@code done = true}.  The terminal frame carries {@code error}
 * when the stream ended abnormally.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionChunk(
        String content,
        String model,
        String provider,
        boolean done,
        String error
) {

    public static CompletionChunk content(String content, String model, String provider) {
        return new CompletionChunk(content, model, provider, false, null);
    }

    public static CompletionChunk done(String model, String provider) {
        return new CompletionChunk(null, model, provider, true, null);
    }

    public static CompletionChunk failed(String model, String provider, String error) {
        return new CompletionChunk(null, model, provider, true, error);
    }

    public boolean isError() {
        return error != null;
    }
}
