package com.openforge.convo.config;

import com.openforge.convo.llm.exception.ConfigurationException;
import com.openforge.convo.llm.provider.ProviderConfig;
import com.openforge.convo.llm.provider.ProviderId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the immutable {@link ProviderConfig} for one provider from
 * {@link ConvoProperties}.  The only place that reads provider settings;
 * adapters receive the result and never look anything up themselves.
 */
@Component
@RequiredArgsConstructor
public class ProviderConfigResolver {

    static final long DEFAULT_TIMEOUT_MS  = 30_000;
    static final int  DEFAULT_MAX_RETRIES = 2;

    private final ConvoProperties properties;

    /**
     * @throws ConfigurationException if the provider needs a key and none is configured
     */
    public ProviderConfig resolve(ProviderId provider) {
        ConvoProperties.ProviderSettings settings = properties.providers().get(provider.configKey());

        String apiKey     = settings == null ? null : blankToNull(settings.apiKey());
        String baseUrl    = settings == null || blankToNull(settings.baseUrl()) == null
                ? provider.defaultBaseUrl()
                : settings.baseUrl();
        long   timeoutMs  = settings == null ? DEFAULT_TIMEOUT_MS : settings.timeoutMs();
        int    maxRetries = settings == null ? DEFAULT_MAX_RETRIES : settings.maxRetries();

        if (provider.requiresApiKey() && apiKey == null) {
            throw new ConfigurationException(
                    "No API key configured for provider [%s]. Set convo.providers.%s.api-key or the %s_API_KEY environment variable."
                            .formatted(provider.configKey(), provider.configKey(), provider.name()));
        }
        return new ProviderConfig(provider, apiKey, baseUrl, timeoutMs, maxRetries);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
