package com.openforge.gateway.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - gatewayStreamExecutor → runs SSE streams off the servlet thread; also drives HttpClient I/O
 *  - Java HttpClient       → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper  → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock                 → every time-dependent component reads time from here
 */
@Configuration
public class AppConfig {

    /**
     * Named "gatewayStreamExecutor" so it never collides with Spring Boot's
     * auto-configured "applicationTaskExecutor".
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService gatewayStreamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "gateway-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request read timeouts come from each backend's config.
     */
    @Bean
    public HttpClient httpClient(ExecutorService gatewayStreamExecutor) {
        return HttpClient.newBuilder()
                .executor(gatewayStreamExecutor)
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, prompt_tokens …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (providers add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** System zone: budget days and months roll over at local midnight. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
