package com.openforge.convo.agent;

import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.config.ProviderConfigResolver;
import com.openforge.convo.llm.exception.ConfigurationException;
import com.openforge.convo.llm.model.GenerationConfig;
import com.openforge.convo.llm.provider.ProviderAdapters;
import com.openforge.convo.llm.provider.ProviderClassifier;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens sessions from configuration.
 *
 * The primary model's adapter is initialized here, before any network call,
 * so a missing key or a malformed base URL or timeout is a
 * {@link ConfigurationException}.  The fallback model's adapter goes through
 * the same checks; if they fail only fallback is disabled for the session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionFactory {

    private final ConvoProperties        properties;
    private final ProviderRegistry       providerRegistry;
    private final ProviderConfigResolver configResolver;

    public Session create(String modelOverride, CancellationToken cancellation) {
        String model = modelOverride == null || modelOverride.isBlank() ? properties.model() : modelOverride;

        ProviderAdapters adapters = providerRegistry.openSession(configResolver::resolve);
        ProviderId primary = ProviderClassifier.classify(model);
        try {
            adapters.adapterFor(primary);
        } catch (ConfigurationException e) {
            adapters.close();
            throw e;
        }
        if (!ProviderClassifier.isRecognized(model)) {
            log.warn("[SessionFactory] Model \"{}\" is not recognized; routing to {}", model, primary);
        }

        String fallback = resolveFallback(model, adapters);
        return new Session(model, fallback,
                properties.maxSessionTurns(),
                properties.streaming(),
                properties.systemInstruction(),
                generationConfig(),
                cancellation,
                adapters);
    }

    private String resolveFallback(String model, ProviderAdapters adapters) {
        String fallback = properties.fallbackModel();
        if (fallback == null || fallback.isBlank() || fallback.equals(model)) {
            return null;
        }
        try {
            adapters.adapterFor(ProviderClassifier.classify(fallback));
            return fallback;
        } catch (ConfigurationException e) {
            log.warn("[SessionFactory] Fallback model {} disabled: {}", fallback, e.getMessage());
            return null;
        }
    }

    private GenerationConfig generationConfig() {
        ConvoProperties.Generation g = properties.generation();
        return GenerationConfig.builder()
                .temperature(g.temperature())
                .maxTokens(g.maxTokens())
                .topP(g.topP())
                .topK(g.topK())
                .stopSequences(g.stopSequences())
                .build();
    }
}
