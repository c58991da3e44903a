package com.openforge.gateway.web;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.agent.AgentRegistry;
import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmException;
import com.openforge.gateway.llm.StreamCancelledException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;
import com.openforge.gateway.routing.AbstractRouter;
import com.openforge.gateway.web.dto.ChatRequestBody;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Chat completions through the configured router.
 *
 * Endpoints:
 *   POST /v1/chat           blocking completion, returns a CompletionResponse
 *   POST /v1/chat/stream    SSE; one CompletionChunk per "data:" frame, last frame has done=true
 *   GET  /healthz           liveness plus the active strategy
 *   GET  /v1/agents         registered agents with their effective settings
 *
 * Admission: every chat call asks {@link AgentRegistry#allow} first and is
 * answered 429 when the agent is over its limit.
 *
 * Streaming runs on {@code gatewayStreamExecutor}.  When the client goes
 * away (completion, timeout or I/O error on the emitter) the stream's
 * cancellation token is fired and the backend stops between chunks.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private final AbstractRouter  gatewayRouter;
    private final AgentRegistry   agentRegistry;
    private final ExecutorService gatewayStreamExecutor;

    // ── Chat ─────────────────────────────────────────────────────────────────

    @PostMapping("/v1/chat")
    public CompletionResponse chat(@Valid @RequestBody ChatRequestBody body) {
        admit(body.agentId());
        return gatewayRouter.complete(body.toCompletionRequest());
    }

    @PostMapping(value = "/v1/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatRequestBody body) {
        admit(body.agentId());
        CompletionRequest request = body.toCompletionRequest();

        // 0 = no timeout; backend read timeouts bound the stream
        SseEmitter emitter = new SseEmitter(0L);
        CancellationToken token = CancellationToken.create();
        emitter.onCompletion(token::cancel);
        emitter.onTimeout(token::cancel);
        emitter.onError(e -> token.cancel());

        gatewayStreamExecutor.execute(() -> {
            try {
                gatewayRouter.stream(token, request, chunk -> send(emitter, token, chunk));
            } catch (StreamCancelledException e) {
                log.debug("[Controller] Stream for agent {} cancelled", request.agentId());
            } catch (LlmException e) {
                // the terminal error chunk has already been sent
                log.warn("[Controller] Stream for agent {} failed: {}", request.agentId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Controller] Uncaught exception in stream for agent {}: {}",
                        request.agentId(), e.getMessage(), e);
                send(emitter, token, CompletionChunk.failed(request.model(), gatewayRouter.id(), e.getMessage()));
            } finally {
                emitter.complete();
            }
        });
        return emitter;
    }

    // ── Discovery ────────────────────────────────────────────────────────────

    @GetMapping("/healthz")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("strategy", gatewayRouter.strategy());
        body.put("backends", gatewayRouter.backendIds());
        return body;
    }

    @GetMapping("/v1/agents")
    public List<AgentConfig> agents() {
        return agentRegistry.list().stream().map(agentRegistry::get).toList();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void admit(String agentId) {
        if (!agentRegistry.allow(agentId)) {
            log.info("[Controller] Agent {} over its request limit", agentId);
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS,
                    "Rate limit exceeded for agent " + agentId);
        }
    }

    /** A failed write means the client is gone: cancel and drop the frame. */
    private static void send(SseEmitter emitter, CancellationToken token, CompletionChunk chunk) {
        if (token.isCancelled()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().data(chunk, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("[Controller] Client disconnected mid-stream: {}", e.getMessage());
            token.cancel();
        }
    }
}
