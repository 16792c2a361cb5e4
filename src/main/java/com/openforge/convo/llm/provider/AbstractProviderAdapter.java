package com.openforge.convo.llm.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.exception.ApiErrorParser;
import com.openforge.convo.llm.exception.ConfigurationException;
import com.openforge.convo.llm.exception.LlmException;
import com.openforge.convo.llm.exception.TransportException;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.stream.ChunkStream;
import com.openforge.convo.llm.stream.LazyChunkStream;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * HTTP plumbing shared by every adapter.
 *
 * Call graph for both blocking and streaming requests:
 *
 *   send(request)
 *     └─ circuitBreaker(provider) + retry(connect failures only)
 *           └─ httpClient.send(...)
 *                 ↓ non-2xx
 *           ApiErrorParser → ApiException / QuotaExceededException
 *
 * Subclasses own only the wire format: payload building, authorization
 * headers and response parsing.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private static final int ERROR_SNIPPET_LINES = 20;
    private static final int ERROR_SNIPPET_CHARS = 4096;

    protected final HttpClient     httpClient;
    protected final ObjectMapper   objectMapper;
    protected final ApiErrorParser errorParser;

    private final ProviderId             providerId;
    private final RetryRegistry          retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    protected ProviderConfig config;
    private Retry          retry;
    private CircuitBreaker circuitBreaker;
    private boolean        closed;

    protected AbstractProviderAdapter(ProviderId providerId,
                                      HttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      RetryRegistry retryRegistry,
                                      CircuitBreakerRegistry circuitBreakerRegistry) {
        this.providerId             = providerId;
        this.httpClient             = httpClient;
        this.objectMapper           = objectMapper;
        this.errorParser            = new ApiErrorParser(objectMapper);
        this.retryRegistry          = retryRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public ProviderId providerId() {
        return providerId;
    }

    @Override
    public synchronized void initialize(ProviderConfig newConfig) {
        Objects.requireNonNull(newConfig, "config");
        if (config != null) {
            if (config.equals(newConfig)) return;
            throw new IllegalStateException("Adapter [%s] is already initialized with a different config"
                    .formatted(providerId));
        }
        validate(newConfig);

        RetryConfig retryConfig = RetryConfig.from(retryRegistry.getDefaultConfig())
                .maxAttempts(newConfig.maxRetries() + 1)
                .retryOnException(AbstractProviderAdapter::isConnectFailure)
                .build();
        this.retry          = retryRegistry.retry(providerId.configKey(), retryConfig);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(providerId.configKey());
        this.config         = newConfig;
        log.debug("[{}] initialized: {}", label(), newConfig);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("[{}] closed", label());
        }
    }

    @Override
    public int countTokens(ChatRequest request) {
        throw new UnsupportedOperationException("Provider [%s] has no token counting endpoint".formatted(providerId));
    }

    @Override
    public ChunkStream streamChat(ChatRequest request) {
        ensureReady();
        return new LazyChunkStream(() -> openStream(request));
    }

    /** Sends the streaming request and wraps the body.  Called on first pull. */
    protected abstract ChunkStream openStream(ChatRequest request);

    /** Adds the provider's authorization headers. */
    protected abstract void authorize(HttpRequest.Builder builder);

    // ── HTTP ─────────────────────────────────────────────────────────────────

    protected HttpRequest.Builder newRequest(String pathAndQuery, boolean streaming) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(config.baseUrl()) + pathAndQuery))
                .header("Content-Type", "application/json")
                // streaming responses can take a long time before the first byte
                .timeout(Duration.ofMillis(streaming ? config.timeoutMs() * 2 : config.timeoutMs()));
        if (streaming) builder.header("Accept", "text/event-stream");
        authorize(builder);
        return builder;
    }

    /** Blocking request; returns the body of a 2xx response. */
    protected String sendForBody(HttpRequest request) {
        HttpResponse<String> response = execute(() -> sendRaw(request, HttpResponse.BodyHandlers.ofString()));
        String body = response.body();
        log.debug("[{}] ← HTTP {} body-length={}", label(), response.statusCode(), body == null ? 0 : body.length());
        if (!isSuccess(response.statusCode())) {
            throw errorParser.toException(providerId, response.statusCode(), body,
                    response.headers().firstValue("retry-after"));
        }
        return body;
    }

    /** Streaming request; returns the line stream of a 2xx response.  The caller closes it. */
    protected Stream<String> sendForLines(HttpRequest request) {
        HttpResponse<Stream<String>> response =
                execute(() -> sendRaw(request, HttpResponse.BodyHandlers.ofLines()));
        if (isSuccess(response.statusCode())) {
            return response.body();
        }
        String snippet;
        try (Stream<String> lines = response.body()) {
            snippet = lines.limit(ERROR_SNIPPET_LINES)
                    .collect(Collectors.joining("\n"));
        } catch (RuntimeException e) {
            log.debug("[{}] Could not read error body: {}", label(), e.getMessage());
            snippet = "";
        }
        if (snippet.length() > ERROR_SNIPPET_CHARS) snippet = snippet.substring(0, ERROR_SNIPPET_CHARS);
        throw errorParser.toException(providerId, response.statusCode(), snippet,
                response.headers().firstValue("retry-after"));
    }

    protected String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request for provider [%s]".formatted(providerId), e);
        }
    }

    protected JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to parse response from provider [%s]: %s"
                    .formatted(providerId, abbreviate(body)), e);
        }
    }

    /** Arguments arrive as a JSON string on OpenAI-style wires.  Malformed input yields empty args. */
    protected Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            Map<String, Object> args = objectMapper.readValue(json, ARGS_TYPE);
            return args == null ? Map.of() : args;
        } catch (JsonProcessingException e) {
            log.warn("[{}] Unparseable function arguments: {}", label(), abbreviate(json));
            return Map.of();
        }
    }

    protected Map<String, Object> toArgs(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Map.of();
        if (node.isTextual()) return parseArguments(node.asText());
        Map<String, Object> args = objectMapper.convertValue(node, ARGS_TYPE);
        return args == null ? Map.of() : args;
    }

    protected String label() {
        return "Adapter:" + providerId.configKey();
    }

    protected void ensureReady() {
        if (closed) throw new IllegalStateException("Adapter [%s] is closed".formatted(providerId));
        if (config == null) throw new IllegalStateException("Adapter [%s] is not initialized".formatted(providerId));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void validate(ProviderConfig candidate) {
        if (candidate.provider() != providerId) {
            throw new ConfigurationException("Config for [%s] handed to the [%s] adapter"
                    .formatted(candidate.provider(), providerId));
        }
        if (providerId.requiresApiKey() && (candidate.apiKey() == null || candidate.apiKey().isBlank())) {
            throw new ConfigurationException("No API key configured for provider [%s]".formatted(providerId));
        }
        if (candidate.baseUrl() == null || candidate.baseUrl().isBlank()) {
            throw new ConfigurationException("No base URL configured for provider [%s]".formatted(providerId));
        }
        try {
            URI uri = URI.create(candidate.baseUrl());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("Base URL for provider [%s] must be absolute: %s"
                        .formatted(providerId, candidate.baseUrl()));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid base URL for provider [%s]: %s"
                    .formatted(providerId, candidate.baseUrl()));
        }
        if (candidate.timeoutMs() <= 0) {
            throw new ConfigurationException("timeout-ms for provider [%s] must be positive".formatted(providerId));
        }
    }

    /**
     * Decorates the call with circuit breaker + retry, then executes it.
     * Fully programmatic, no AOP.
     */
    private <T> T execute(Supplier<T> call) {
        ensureReady();
        Supplier<T> decorated = CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw new TransportException("Provider [%s] is temporarily unavailable (circuit open)"
                    .formatted(providerId), e);
        }
    }

    private <T> HttpResponse<T> sendRaw(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        log.debug("[{}] → {} {}", label(), request.method(), request.uri().getPath());
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException e) {
            throw new TransportException("Provider [%s] timed out after %d ms"
                    .formatted(providerId, config.timeoutMs()), e);
        } catch (IOException e) {
            throw new TransportException("Network error calling provider [%s]: %s"
                    .formatted(providerId, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AbortedException("Request to provider [%s] was interrupted".formatted(providerId));
        }
    }

    private static boolean isConnectFailure(Throwable t) {
        return t instanceof TransportException && t.getCause() instanceof ConnectException;
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 500 ? s.substring(0, 500) + "..." : s;
    }
}
