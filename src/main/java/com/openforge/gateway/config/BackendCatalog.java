package com.openforge.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.gateway.llm.LlmBackend;
import com.openforge.gateway.llm.openai.OpenAiCompatibleBackend;
import com.openforge.gateway.resilience.BreakerStatus;
import com.openforge.gateway.resilience.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every configured backend, each wrapped in its own {@link CircuitBreaker}.
 *
 * There is exactly one breaker per backend id; all routing strategies and
 * the failover chain share these instances, so a backend tripped by one path
 * is seen as open by every other.
 */
@Slf4j
public class BackendCatalog {

    private final Map<String, CircuitBreaker> breakers;
    private final String localBackendId;

    public BackendCatalog(Map<String, CircuitBreaker> breakers, String localBackendId) {
        this.breakers       = Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
        this.localBackendId = localBackendId;
    }

    /** Builds HTTP backends from configuration; duplicate ids are rejected. */
    public static BackendCatalog fromProperties(GatewayProperties properties,
                                                HttpClient httpClient,
                                                ObjectMapper objectMapper,
                                                Clock clock) {
        GatewayProperties.BreakerProperties breakerProps = properties.breaker();
        Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
        String localId = null;
        for (GatewayProperties.BackendProperties backend : properties.backends()) {
            if (backend.id() == null || backend.id().isBlank()) {
                throw new IllegalStateException("gateway.backends entry without an id");
            }
            if (breakers.containsKey(backend.id())) {
                throw new IllegalStateException("duplicate backend id '%s'".formatted(backend.id()));
            }
            LlmBackend http = new OpenAiCompatibleBackend(httpClient, objectMapper, backend);
            breakers.put(backend.id(), new CircuitBreaker(http,
                    breakerProps.failureThreshold(), breakerProps.resetTimeout(), clock));
            if (!backend.cloud() && localId == null) {
                localId = backend.id();
            }
        }
        // the configured local backend wins over the first non-cloud entry
        if (properties.localBackend() != null && breakers.containsKey(properties.localBackend())) {
            localId = properties.localBackend();
        }
        log.info("[BackendCatalog] {} backend(s): {} local={}", breakers.size(), breakers.keySet(), localId);
        return new BackendCatalog(breakers, localId);
    }

    public Map<String, CircuitBreaker> all() {
        return breakers;
    }

    public Optional<CircuitBreaker> find(String backendId) {
        return Optional.ofNullable(breakers.get(backendId));
    }

    public Optional<CircuitBreaker> local() {
        return localBackendId == null ? Optional.empty() : find(localBackendId);
    }

    /** Every backend except the local one, in declaration order. */
    public Map<String, CircuitBreaker> cloud() {
        Map<String, CircuitBreaker> cloud = new LinkedHashMap<>(breakers);
        if (localBackendId != null) {
            cloud.remove(localBackendId);
        }
        return cloud;
    }

    /**
     * Breakers in failover order.  Ids in {@code order} that are not
     * configured are skipped with a warning; an empty order means
     * declaration order.
     */
    public List<CircuitBreaker> ordered(List<String> order) {
        if (order == null || order.isEmpty()) {
            return List.copyOf(breakers.values());
        }
        List<CircuitBreaker> result = new ArrayList<>();
        for (String id : order) {
            CircuitBreaker breaker = breakers.get(id);
            if (breaker == null) {
                log.warn("[BackendCatalog] Failover order names unknown backend '{}'; skipped", id);
                continue;
            }
            result.add(breaker);
        }
        return result;
    }

    public boolean resetBreaker(String backendId) {
        Optional<CircuitBreaker> breaker = find(backendId);
        breaker.ifPresent(CircuitBreaker::reset);
        return breaker.isPresent();
    }

    public List<BreakerStatus> statuses() {
        return breakers.values().stream().map(CircuitBreaker::snapshot).toList();
    }
}
