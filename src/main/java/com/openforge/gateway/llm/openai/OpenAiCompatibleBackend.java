package com.openforge.gateway.llm.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.gateway.config.GatewayProperties;
import com.openforge.gateway.llm.CancellationToken;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.LlmException;
import com.openforge.gateway.llm.LlmRateLimitException;
import com.openforge.gateway.llm.model.CompletionChunk;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.llm.model.CompletionResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless HTTP backend for any OpenAI-compatible /chat/completions API.
 *
 * Two modes of operation:
 *
 *  complete()    synchronous, waits for the full response.
 *
 *  stream()      SSE; emits one CompletionChunk per content delta and a
 *                single terminal chunk when the stream ends or fails.
 *                Cancellation counts as a failure.
 *
 * Both methods block the calling thread; the routing layer above is
 * synchronous per request.
 */
@Slf4j
public class OpenAiCompatibleBackend implements LlmBackend {

    private static final String SSE_DATA_PREFIX = "data: ";
    private static final String SSE_DONE        = "data: [DONE]";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.BackendProperties config;

    public OpenAiCompatibleBackend(HttpClient httpClient,
                                   ObjectMapper objectMapper,
                                   GatewayProperties.BackendProperties config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        String model = resolveModel(request);
        String requestBody = serialize(ChatRequest.from(request, model, false));
        log.debug("[Backend:{}] → complete POST model={} body-length={}", id(), model, requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody, false));
        ChatResponse chat = parseFullResponse(httpResponse);

        CompletionResponse.Usage usage = chat.usage() == null
                ? CompletionResponse.Usage.EMPTY
                : new CompletionResponse.Usage(chat.usage().promptTokens(),
                        chat.usage().completionTokens(), chat.usage().totalTokens());
        String resolvedModel = chat.model() != null ? chat.model() : model;
        return new CompletionResponse(chat.firstContent(), resolvedModel, id(), usage);
    }

    /**
     * Streaming completion via SSE.
     *
     * Every failure after this method is entered, including cancellation,
     * first emits a terminal chunk with the error text and then throws.
     */
    @Override
    public void stream(CancellationToken token, CompletionRequest request, Consumer<CompletionChunk> emit) {
        String model = resolveModel(request);
        try {
            doStream(token, request, model, emit);
        } catch (LlmException e) {
            emit.accept(CompletionChunk.failed(model, id(), e.getMessage()));
            throw e;
        }
        emit.accept(CompletionChunk.done(model, id()));
    }

    /** The model used when a request does not name one. */
    public String defaultModel() {
        return config.defaultModel();
    }

    // ── Streaming ────────────────────────────────────────────────────────────

    private void doStream(CancellationToken token, CompletionRequest request, String model,
                          Consumer<CompletionChunk> emit) {
        String requestBody = serialize(ChatRequest.from(request, model, true));
        log.debug("[Backend:{}] → stream POST model={} body-length={}", id(), model, requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(
                    buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]".formatted(id()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted (streaming) calling provider [%s]".formatted(id()), e);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            httpResponse.body().close();
            throw new LlmRateLimitException("Rate-limited by provider [%s].".formatted(id()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet;
            try (Stream<String> lines = httpResponse.body()) {
                bodySnippet = String.join("\n", lines.limit(20).toList());
            }
            throw new LlmException("Provider [%s] returned HTTP %d on stream open: %s"
                    .formatted(id(), status, truncate(bodySnippet, 2048)));
        }

        try (Stream<String> lines = httpResponse.body()) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                token.throwIfCancelled();
                String line = it.next();
                if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) continue;
                if (SSE_DONE.equals(line)) break;

                String content = parseDelta(line.substring(SSE_DATA_PREFIX.length()));
                if (content != null && !content.isEmpty()) {
                    emit.accept(CompletionChunk.content(content, model, id()));
                }
            }
        } catch (UncheckedIOException e) {
            throw new LlmException("Stream from provider [%s] broke: %s".formatted(id(), e.getMessage()), e);
        }
        token.throwIfCancelled();
    }

    private String parseDelta(String json) {
        StreamingChunk chunk;
        try {
            chunk = objectMapper.readValue(json, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("[Backend:{}] Failed to parse SSE chunk: {}", id(), json);
            return null;
        }
        if (chunk.choices() == null || chunk.choices().isEmpty()) return null;
        StreamingChunk.DeltaMessage delta = chunk.choices().get(0).delta();
        return delta == null ? null : delta.content();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String resolveModel(CompletionRequest request) {
        if (request == null) {
            throw new LlmException("CompletionRequest must not be null for provider [%s]".formatted(id()));
        }
        return request.hasModel() ? request.model() : config.defaultModel();
    }

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                // Streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(streaming ? config.timeoutSeconds() * 2L : config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder.build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(id()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling provider [%s]".formatted(id()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[Backend:{}] ← HTTP {} body-length={}", id(), status, body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(id()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(id(), status, truncate(body, 2048)));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(id(), truncate(body, 512)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
