package com.openforge.gateway.llm;

/** The caller cancelled a stream via its {@link CancellationToken}. */
public class StreamCancelledException extends LlmException {

    public StreamCancelledException() {
        super("cancelled");
    }
}
