package com.openforge.gateway.routing;

import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.model.CompletionRequest;

/**
 * Outcome of backend selection: where the request goes and in what shape.
 *
 * @param request the request as the backend should see it (model possibly rewritten)
 * @param local   true when the backend runs on local hardware
 */
public record Route(LlmBackend backend, CompletionRequest request, boolean local) {}
