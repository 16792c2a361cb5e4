package com.openforge.convo.llm.provider;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Maps a model identifier to the provider that serves it.
 *
 * Resolution order:
 *   1. exact lookup in MODEL_TO_PROVIDER
 *   2. ordered PATTERNS, first match wins (case-insensitive)
 *   3. DEFAULT_PROVIDER, so new model names from the default vendor keep working
 *
 * An "ollama/" prefix routes any model name to the local Ollama server.
 * All lookups are static and side-effect free; callers classify on every request.
 */
public final class ProviderClassifier {

    public static final ProviderId DEFAULT_PROVIDER = ProviderId.GEMINI;
    public static final String     OLLAMA_PREFIX    = "ollama/";

    /** Context window assumed for model ids nothing recognizes. */
    public static final int CONSERVATIVE_CONTEXT_LIMIT = 4096;

    private static final Map<String, ProviderId> MODEL_TO_PROVIDER = Map.ofEntries(
            // OpenAI
            entry("gpt-4o",                     ProviderId.OPENAI),
            entry("gpt-4o-mini",                ProviderId.OPENAI),
            entry("gpt-4",                      ProviderId.OPENAI),
            entry("gpt-4-turbo",                ProviderId.OPENAI),
            entry("gpt-3.5-turbo",              ProviderId.OPENAI),
            // Anthropic
            entry("claude-opus-4-20250514",     ProviderId.ANTHROPIC),
            entry("claude-sonnet-4-20250514",   ProviderId.ANTHROPIC),
            entry("claude-3-7-sonnet-20250219", ProviderId.ANTHROPIC),
            entry("claude-3-7-sonnet-latest",   ProviderId.ANTHROPIC),
            entry("claude-3-5-sonnet-20241022", ProviderId.ANTHROPIC),
            entry("claude-3-5-sonnet-latest",   ProviderId.ANTHROPIC),
            entry("claude-3-5-sonnet-20240620", ProviderId.ANTHROPIC),
            entry("claude-3-5-haiku-20241022",  ProviderId.ANTHROPIC),
            entry("claude-3-5-haiku-latest",    ProviderId.ANTHROPIC),
            entry("claude-3-opus-20240229",     ProviderId.ANTHROPIC),
            entry("claude-3-sonnet-20240229",   ProviderId.ANTHROPIC),
            entry("claude-3-haiku-20240307",    ProviderId.ANTHROPIC),
            // DeepSeek
            entry("deepseek-chat",              ProviderId.DEEPSEEK),
            entry("deepseek-coder",             ProviderId.DEEPSEEK),
            entry("deepseek-reasoner",          ProviderId.DEEPSEEK),
            // Qwen
            entry("qwen-turbo",                 ProviderId.QWEN),
            entry("qwen-plus",                  ProviderId.QWEN),
            entry("qwen-max",                   ProviderId.QWEN),
            entry("qwq-32b-preview",            ProviderId.QWEN),
            entry("qwen2.5-72b-instruct",       ProviderId.QWEN),
            entry("qwen2.5-32b-instruct",       ProviderId.QWEN),
            entry("qwen2.5-14b-instruct",       ProviderId.QWEN),
            entry("qwen2.5-7b-instruct",        ProviderId.QWEN),
            entry("qwen-vl-plus",               ProviderId.QWEN),
            entry("qwen-vl-max",                ProviderId.QWEN),
            entry("qvq-72b-preview",            ProviderId.QWEN),
            // Gemini
            entry("gemini-1.5-pro",             ProviderId.GEMINI),
            entry("gemini-1.5-flash",           ProviderId.GEMINI),
            entry("gemini-2.5-pro",             ProviderId.GEMINI),
            entry("gemini-2.5-flash",           ProviderId.GEMINI),
            entry("gemini-2.0-flash",           ProviderId.GEMINI),
            // Groq
            entry("llama-3.1-8b-instant",       ProviderId.GROQ),
            entry("llama-3.1-70b-versatile",    ProviderId.GROQ),
            entry("mixtral-8x7b-32768",         ProviderId.GROQ),
            // Mistral
            entry("mistral-small-latest",       ProviderId.MISTRAL),
            entry("mistral-medium-latest",      ProviderId.MISTRAL),
            entry("mistral-large-latest",       ProviderId.MISTRAL),
            // Moonshot
            entry("kimi-k2-0711-preview",       ProviderId.MOONSHOT),
            entry("moonshot-v1-8k",             ProviderId.MOONSHOT),
            entry("moonshot-v1-32k",            ProviderId.MOONSHOT),
            entry("moonshot-v1-128k",           ProviderId.MOONSHOT)
    );

    private record ProviderPattern(Pattern pattern, ProviderId provider) {
        static ProviderPattern of(String regex, ProviderId provider) {
            return new ProviderPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), provider);
        }
    }

    private static final List<ProviderPattern> PATTERNS = List.of(
            ProviderPattern.of("^gpt-",      ProviderId.OPENAI),
            ProviderPattern.of("^o[134](-|$)", ProviderId.OPENAI),
            ProviderPattern.of("^claude-",   ProviderId.ANTHROPIC),
            ProviderPattern.of("^deepseek-", ProviderId.DEEPSEEK),
            ProviderPattern.of("^qwen",      ProviderId.QWEN),
            ProviderPattern.of("^qwq-",      ProviderId.QWEN),
            ProviderPattern.of("^qvq-",      ProviderId.QWEN),
            ProviderPattern.of("^gemini-",   ProviderId.GEMINI),
            ProviderPattern.of("^llama-",    ProviderId.GROQ),
            ProviderPattern.of("^mixtral-",  ProviderId.GROQ),
            ProviderPattern.of("^mistral-",  ProviderId.MISTRAL),
            ProviderPattern.of("^kimi-",     ProviderId.MOONSHOT),
            ProviderPattern.of("^moonshot-", ProviderId.MOONSHOT)
    );

    private ProviderClassifier() {
    }

    // ── Classification ───────────────────────────────────────────────────────

    public static ProviderId classify(String modelId) {
        ProviderId known = lookup(modelId);
        return known != null ? known : DEFAULT_PROVIDER;
    }

    /** True if the table, a pattern or the ollama prefix claims this id. */
    public static boolean isRecognized(String modelId) {
        return lookup(modelId) != null;
    }

    /** The model name as the provider expects it, i.e. without the "ollama/" routing prefix. */
    public static String wireModelName(String modelId) {
        if (modelId != null && modelId.regionMatches(true, 0, OLLAMA_PREFIX, 0, OLLAMA_PREFIX.length())) {
            return modelId.substring(OLLAMA_PREFIX.length());
        }
        return modelId;
    }

    // ── Capabilities ─────────────────────────────────────────────────────────

    /** Only Gemini exposes a countTokens endpoint; everyone else goes through the estimator. */
    public static boolean supportsNativeTokenCounting(ProviderId provider) {
        return provider == ProviderId.GEMINI;
    }

    public static int approximateContextLimit(String modelId) {
        ProviderId provider = lookup(modelId);
        if (provider == null) return CONSERVATIVE_CONTEXT_LIMIT;

        String m = modelId.toLowerCase(Locale.ROOT);
        return switch (provider) {
            case OPENAI -> {
                if (m.contains("gpt-4o"))  yield 128_000;
                if (m.contains("gpt-4"))   yield 8_192;
                if (m.contains("gpt-3.5")) yield 4_096;
                if (m.startsWith("o"))     yield 128_000;
                yield 4_096;
            }
            case ANTHROPIC -> 200_000;
            case DEEPSEEK  -> 32_768;
            case QWEN -> {
                if (m.contains("turbo")) yield 1_008_192;
                if (m.contains("plus"))  yield 131_072;
                if (m.contains("max"))   yield 32_768;
                if (m.contains("2.5"))   yield 131_072;
                yield 32_768;
            }
            case GEMINI   -> m.contains("1.5-pro") ? 2_097_152 : 1_048_576;
            case GROQ, MISTRAL -> 32_768;
            case MOONSHOT -> m.startsWith("kimi-") || m.contains("128k") ? 128_000 : 32_768;
            case OLLAMA   -> 8_192;
        };
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static ProviderId lookup(String modelId) {
        if (modelId == null || modelId.isBlank()) return null;

        if (modelId.regionMatches(true, 0, OLLAMA_PREFIX, 0, OLLAMA_PREFIX.length())) {
            return ProviderId.OLLAMA;
        }

        ProviderId exact = MODEL_TO_PROVIDER.get(modelId);
        if (exact != null) return exact;

        for (ProviderPattern p : PATTERNS) {
            if (p.pattern().matcher(modelId).find()) {
                return p.provider();
            }
        }
        return null;
    }
}
