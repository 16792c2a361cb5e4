package com.openforge.convo.llm.provider;

/**
 * Connection settings for exactly one provider.  Built once when a session
 * starts and never shared between providers.
 *
 *   maxRetries - extra attempts when the connection cannot be established;
 *                requests that reached the server are never retried here
 */
public record ProviderConfig(
        ProviderId provider,
        String     apiKey,
        String     baseUrl,
        long       timeoutMs,
        int        maxRetries
) {

    @Override
    public String toString() {
        return "ProviderConfig[provider=%s, baseUrl=%s, apiKey=%s, timeoutMs=%d, maxRetries=%d]"
                .formatted(provider, baseUrl, maskKey(apiKey), timeoutMs, maxRetries);
    }

    /** First 6 chars + "..." + last 4 chars. */
    public static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
