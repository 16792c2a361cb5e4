package com.openforge.convo.llm.provider;

import java.util.Locale;

/**
 * Closed set of backends this CLI can talk to.
 *
 * Each constant carries its wire family, the public endpoint used when no
 * base-url is configured, and whether a key is mandatory.
 */
public enum ProviderId {

    OPENAI   (AdapterFamily.OPENAI_COMPATIBLE, "https://api.openai.com/v1",                          true),
    ANTHROPIC(AdapterFamily.ANTHROPIC,         "https://api.anthropic.com/v1",                       true),
    DEEPSEEK (AdapterFamily.OPENAI_COMPATIBLE, "https://api.deepseek.com/v1",                        true),
    QWEN     (AdapterFamily.OPENAI_COMPATIBLE, "https://dashscope.aliyuncs.com/compatible-mode/v1",  true),
    GEMINI   (AdapterFamily.GEMINI,            "https://generativelanguage.googleapis.com/v1beta",   true),
    GROQ     (AdapterFamily.OPENAI_COMPATIBLE, "https://api.groq.com/openai/v1",                     true),
    MISTRAL  (AdapterFamily.OPENAI_COMPATIBLE, "https://api.mistral.ai/v1",                          true),
    MOONSHOT (AdapterFamily.OPENAI_COMPATIBLE, "https://api.moonshot.cn/v1",                         true),
    OLLAMA   (AdapterFamily.OLLAMA,            "http://localhost:11434",                             false);

    private final AdapterFamily family;
    private final String        defaultBaseUrl;
    private final boolean       requiresApiKey;

    ProviderId(AdapterFamily family, String defaultBaseUrl, boolean requiresApiKey) {
        this.family         = family;
        this.defaultBaseUrl = defaultBaseUrl;
        this.requiresApiKey = requiresApiKey;
    }

    public AdapterFamily family() {
        return family;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    /** Key used under convo.providers in application.yml, e.g. "deepseek". */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
