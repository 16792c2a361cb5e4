package com.openforge.convo.llm.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.llm.provider.anthropic.AnthropicAdapter;
import com.openforge.convo.llm.provider.gemini.GeminiAdapter;
import com.openforge.convo.llm.provider.ollama.OllamaAdapter;
import com.openforge.convo.llm.provider.openai.OpenAiCompatibleAdapter;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Creates adapters by provider identity.
 *
 * One factory per {@link AdapterFamily}; the turn loop never branches on a
 * provider, it asks for an adapter and talks to the interface.
 */
@Component
public class ProviderRegistry {

    @FunctionalInterface
    public interface AdapterFactory {
        ProviderAdapter create(ProviderId providerId);
    }

    private final Map<AdapterFamily, AdapterFactory> factories = new EnumMap<>(AdapterFamily.class);

    public ProviderRegistry(HttpClient httpClient,
                            ObjectMapper objectMapper,
                            RetryRegistry retryRegistry,
                            CircuitBreakerRegistry circuitBreakerRegistry) {
        factories.put(AdapterFamily.OPENAI_COMPATIBLE, id ->
                new OpenAiCompatibleAdapter(id, httpClient, objectMapper, retryRegistry, circuitBreakerRegistry));
        factories.put(AdapterFamily.GEMINI, id ->
                new GeminiAdapter(httpClient, objectMapper, retryRegistry, circuitBreakerRegistry));
        factories.put(AdapterFamily.ANTHROPIC, id ->
                new AnthropicAdapter(httpClient, objectMapper, retryRegistry, circuitBreakerRegistry));
        factories.put(AdapterFamily.OLLAMA, id ->
                new OllamaAdapter(httpClient, objectMapper, retryRegistry, circuitBreakerRegistry));
    }

    /** A fresh, uninitialized adapter. */
    public ProviderAdapter create(ProviderId providerId) {
        AdapterFactory factory = factories.get(providerId.family());
        if (factory == null) {
            throw new IllegalStateException("No adapter registered for family " + providerId.family());
        }
        return factory.create(providerId);
    }

    /** Adapter pool for one session, configured through {@code configResolver}. */
    public ProviderAdapters openSession(Function<ProviderId, ProviderConfig> configResolver) {
        return new ProviderAdapters(this::create, configResolver);
    }
}
